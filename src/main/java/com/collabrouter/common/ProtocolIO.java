package com.collabrouter.common;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for sending/receiving length-prefixed JSON envelopes over a TCP socket.
 * Each frame is [4-byte big-endian length][UTF-8 JSON]. A zero-length frame is the close
 * frame: the peer will send nothing more.
 */
public final class ProtocolIO {

    public static final int DEFAULT_MAX_FRAME_BYTES = 10_000_000;  // 10MB max message

    private ProtocolIO() {
    }

    public static void sendMessage(Socket socket, Envelope envelope) throws IOException {
        // Synchronize on the socket: the outbound loop and direct replies share the stream
        synchronized (socket) {
            writeFrame(socket.getOutputStream(), envelope, DEFAULT_MAX_FRAME_BYTES);
        }
    }

    public static void sendClose(Socket socket) throws IOException {
        synchronized (socket) {
            writeCloseFrame(socket.getOutputStream());
        }
    }

    public static Envelope readMessage(Socket socket, int maxFrameBytes) throws IOException {
        return readFrame(socket.getInputStream(), maxFrameBytes);
    }

    public static void writeFrame(OutputStream stream, Envelope envelope, int maxFrameBytes) throws IOException {
        byte[] data = EnvelopeCodec.toJson(envelope).getBytes(StandardCharsets.UTF_8);
        if (data.length > maxFrameBytes) {
            throw new ProtocolException("Message too large: " + data.length + " bytes exceeds limit of " + maxFrameBytes);
        }
        DataOutputStream out = new DataOutputStream(stream);
        out.writeInt(data.length);
        out.write(data);
        out.flush();
    }

    public static void writeCloseFrame(OutputStream stream) throws IOException {
        DataOutputStream out = new DataOutputStream(stream);
        out.writeInt(0);
        out.flush();
    }

    /**
     * Blocks until one full frame has been read.
     *
     * @throws EOFException      on a close frame or end of stream
     * @throws ProtocolException on an invalid length or undecodable payload
     */
    public static Envelope readFrame(InputStream stream, int maxFrameBytes) throws IOException {
        DataInputStream in = new DataInputStream(stream);
        int length = in.readInt();
        if (length == 0) {
            throw new EOFException("Peer sent close frame");
        }
        if (length < 0 || length > maxFrameBytes) {
            throw new ProtocolException("Invalid message length: " + length);
        }
        byte[] data = new byte[length];
        in.readFully(data);
        return EnvelopeCodec.fromJson(new String(data, StandardCharsets.UTF_8));
    }
}
