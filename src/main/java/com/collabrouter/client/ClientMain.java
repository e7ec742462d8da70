package com.collabrouter.client;

import com.collabrouter.common.DocumentSummary;
import com.collabrouter.common.Envelope;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Console chat client: {@code ClientMain <host> <port> <token>}.
 * Lines are broadcast; {@code /w <name> <text>} whispers, {@code /docs} lists documents,
 * {@code /quit} exits.
 */
public class ClientMain {

    public static void main(String[] args) throws IOException, InterruptedException {
        if (args.length < 3) {
            System.err.println("Usage: ClientMain <host> <port> <token>");
            System.exit(2);
        }
        String host = args[0];
        int port;
        try {
            port = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid port: " + args[1]);
            System.exit(2);
            return;
        }

        PrintStream out = System.out;
        try (RouterClient client = RouterClient.connect(host, port, args[2], envelope -> out.println(render(envelope)));
             BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while (client.isConnected() && (line = in.readLine()) != null) {
                if (line.equals("/quit")) {
                    break;
                } else if (line.equals("/docs")) {
                    client.requestDocuments();
                } else if (line.startsWith("/w ")) {
                    String[] parts = line.substring(3).split(" ", 2);
                    if (parts.length == 2) {
                        client.sendPrivate(parts[0], parts[1]);
                    } else {
                        out.println("Usage: /w <name> <text>");
                    }
                } else if (!line.isBlank()) {
                    client.sendBroadcast(line);
                }
            }
        }
    }

    static String render(Envelope envelope) {
        return switch (envelope.getType()) {
            case PUBLIC -> {
                Envelope.Broadcast b = (Envelope.Broadcast) envelope;
                yield b.getSender() + ": " + b.getBody();
            }
            case PRIVATE -> {
                Envelope.Private p = (Envelope.Private) envelope;
                yield "[" + p.getFrom() + " -> " + p.getTo() + "] " + p.getBody();
            }
            case SYSTEM -> {
                Envelope.SystemNotice s = (Envelope.SystemNotice) envelope;
                yield "[SERVER] " + s.getBody() + (s.getUserList().isEmpty() ? "" : " (online: " + String.join(", ", s.getUserList()) + ")");
            }
            case DOC_LIST -> {
                StringBuilder sb = new StringBuilder("[DOCS]");
                for (DocumentSummary doc : ((Envelope.DocumentList) envelope).getDocuments()) {
                    sb.append(System.lineSeparator()).append("  ").append(doc.getId()).append("  ").append(doc.getName())
                        .append(" (").append(doc.getLanguage()).append(")");
                }
                yield sb.toString();
            }
            case DOC_CONTENT -> "[DOC] " + ((Envelope.DocumentContent) envelope).getDocument().getName();
            case DOC_UPDATE -> {
                Envelope.DocumentEdit e = (Envelope.DocumentEdit) envelope;
                yield "[EDIT] " + e.getSender() + " changed " + e.getDocumentId();
            }
            case USER_JOINED -> "[DOC] " + ((Envelope.UserJoined) envelope).getWho() + " joined the document";
            case USER_LEFT -> "[DOC] " + ((Envelope.UserLeft) envelope).getWho() + " left the document";
            case UNAUTHORIZED -> "[ERROR] " + ((Envelope.Unauthorized) envelope).getReason();
            case DOC_OPEN, DOC_CREATE, AUTH -> "[?] " + envelope.getType().getTag();
        };
    }
}
