package com.collabrouter.client;

import com.collabrouter.common.Envelope;
import com.collabrouter.common.ProtocolIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Headless client for the router's wire protocol. Sends the auth handshake on connect,
 * then hands every received envelope to the listener on a dedicated reader thread.
 *
 * The server stamps sender names and times, so the send methods only take what the
 * client actually chooses.
 */
public class RouterClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RouterClient.class);

    private final Socket socket;
    private final Consumer<Envelope> listener;
    private final ExecutorService readerExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "router-client-reader");
        t.setDaemon(true);
        return t;
    });
    private final CountDownLatch disconnected = new CountDownLatch(1);
    private volatile boolean running = true;

    private RouterClient(Socket socket, Consumer<Envelope> listener) {
        this.socket = socket;
        this.listener = listener;
    }

    public static RouterClient connect(String host, int port, String token, Consumer<Envelope> listener)
        throws IOException {
        Socket socket = new Socket(host, port);
        socket.setTcpNoDelay(true);
        RouterClient client = new RouterClient(socket, listener);
        try {
            client.send(new Envelope.Hello(token));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        client.startReaderLoop();
        return client;
    }

    public void sendBroadcast(String text) throws IOException {
        send(new Envelope.Broadcast(null, text, null));
    }

    public void sendPrivate(String to, String text) throws IOException {
        send(new Envelope.Private(null, to, text, null));
    }

    public void requestDocuments() throws IOException {
        send(new Envelope.DocumentList());
    }

    public void openDocument(String documentId) throws IOException {
        send(new Envelope.DocumentOpen(documentId));
    }

    public void createDocument(String name, String language) throws IOException {
        send(new Envelope.DocumentCreate(name, language));
    }

    /**
     * @param content the full document text after the local change
     */
    public void sendEdit(String documentId, String content) throws IOException {
        send(new Envelope.DocumentEdit(documentId, null, content));
    }

    public void send(Envelope envelope) throws IOException {
        if (!running || socket.isClosed()) {
            throw new IOException("Connection closed");
        }
        ProtocolIO.sendMessage(socket, envelope);
    }

    public boolean isConnected() {
        return running && !socket.isClosed();
    }

    /**
     * Waits for the server to end the session (close frame, unauthorized or transport error).
     */
    public boolean awaitDisconnect(long timeout, TimeUnit unit) throws InterruptedException {
        return disconnected.await(timeout, unit);
    }

    @Override
    public void close() {
        if (running && !socket.isClosed()) {
            try {
                ProtocolIO.sendClose(socket);
            } catch (IOException e) {
                log.debug("Failed to send close frame: {}", e.getMessage());
            }
        }
        running = false;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
        readerExecutor.shutdownNow();
    }

    private void startReaderLoop() {
        readerExecutor.submit(() -> {
            try {
                while (running && !socket.isClosed()) {
                    listener.accept(ProtocolIO.readMessage(socket, ProtocolIO.DEFAULT_MAX_FRAME_BYTES));
                }
            } catch (EOFException e) {
                log.debug("Server closed the connection");
            } catch (IOException e) {
                if (running) {
                    log.info("Disconnected from server: {}", e.getMessage());
                }
            } finally {
                running = false;
                disconnected.countDown();
            }
        });
    }
}
