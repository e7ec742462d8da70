package com.collabrouter.server;

import com.collabrouter.common.Envelope;
import com.collabrouter.common.ProtocolIO;
import com.collabrouter.server.auth.AuthenticationException;
import com.collabrouter.server.auth.Authenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One accepted socket. {@link #run()} is the inbound loop: handshake, then decode and
 * dispatch one envelope at a time. A dedicated sender thread drains the participant's
 * outbox onto the socket.
 */
public class ClientConnection implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private static final long POLL_MILLIS = 500;

    private final long connectionId;
    private final Socket socket;
    private final Router router;
    private final Authenticator authenticator;
    private final DocumentSessionHandler documents;
    private final RouterConfig config;
    private final Clock clock;
    private final Consumer<ClientConnection> onClosed;

    private final AtomicInteger activeLoops = new AtomicInteger(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile Participant participant;

    public ClientConnection(long connectionId, Socket socket, Router router, Authenticator authenticator,
                            DocumentSessionHandler documents, RouterConfig config, Clock clock,
                            Consumer<ClientConnection> onClosed) {
        this.connectionId = connectionId;
        this.socket = socket;
        this.router = router;
        this.authenticator = authenticator;
        this.documents = documents;
        this.config = config;
        this.clock = clock;
        this.onClosed = onClosed;

        try {
            socket.setTcpNoDelay(true);
        } catch (IOException e) {
            log.warn("Connection {}: failed to configure socket: {}", connectionId, e.getMessage());
        }
    }

    public ConnectionState getState() {
        return state;
    }

    /** Null until the handshake succeeds. */
    public Participant getParticipant() {
        return participant;
    }

    @Override
    public void run() {
        boolean registered = false;
        try {
            Participant authenticated = handshake();
            if (authenticated == null) {
                return;
            }
            participant = authenticated;
            startSender(authenticated);
            router.register(authenticated);
            registered = true;
            state = ConnectionState.REGISTERED;
            log.info("Connection {} registered as {}", connectionId, authenticated.getName());

            while (!socket.isClosed()) {
                dispatch(ProtocolIO.readMessage(socket, config.getMaxFrameBytes()));
            }
        } catch (EOFException e) {
            log.debug("Connection {} closed by peer", connectionId);
        } catch (IOException e) {
            log.debug("Connection {} read error: {}", connectionId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = ConnectionState.DRAINING;
            if (registered) {
                unregister();
            } else if (participant != null) {
                participant.getOutbox().close();
            }
            loopExited();
        }
    }

    /**
     * Closes the socket, which ends both loops.
     */
    public void close() {
        closeSocket();
    }

    /**
     * Waits until both loops have exited and the socket is closed.
     */
    public boolean awaitClosed(long timeout, TimeUnit unit) throws InterruptedException {
        return closed.await(timeout, unit);
    }

    private Participant handshake() throws IOException {
        Envelope first = ProtocolIO.readMessage(socket, config.getMaxFrameBytes());
        if (!(first instanceof Envelope.Hello)) {
            reject("Expected auth frame, got " + first.getType().getTag());
            return null;
        }
        String name;
        try {
            name = authenticator.authenticate(((Envelope.Hello) first).getToken());
        } catch (AuthenticationException e) {
            reject(e.getMessage());
            return null;
        }
        return new Participant(name, new Outbox(config.getOutboxCapacity()));
    }

    private void reject(String reason) throws IOException {
        log.info("Connection {} unauthorized: {}", connectionId, reason);
        ProtocolIO.sendMessage(socket, new Envelope.Unauthorized("Unauthorized: " + reason));
        ProtocolIO.sendClose(socket);
        closeSocket();
    }

    private void dispatch(Envelope message) throws IOException, InterruptedException {
        Participant self = participant;
        log.debug("Received {} from {}", message.getType(), self.getName());
        switch (message.getType()) {
            case DOC_LIST -> documents.handleList(self, this::reply);
            case DOC_OPEN -> documents.handleOpen(self, ((Envelope.DocumentOpen) message).getDocumentId(), this::reply);
            case DOC_CREATE -> {
                Envelope.DocumentCreate create = (Envelope.DocumentCreate) message;
                documents.handleCreate(self, create.getName(), create.getLanguage(), this::reply);
            }
            case DOC_UPDATE -> documents.handleEdit(self, (Envelope.DocumentEdit) message);
            case PRIVATE -> {
                Envelope.Private p = (Envelope.Private) message;
                if (p.getTo() != null && !p.getTo().isEmpty()) {
                    router.routePrivate(new Envelope.Private(self.getName(), p.getTo(), p.getBody(), clock.instant()));
                }
            }
            case PUBLIC -> router.routeBroadcast(
                new Envelope.Broadcast(self.getName(), ((Envelope.Broadcast) message).getBody(), clock.instant()));
            // clients cannot speak for the server: a system frame is just chat
            case SYSTEM -> router.routeBroadcast(
                new Envelope.Broadcast(self.getName(), ((Envelope.SystemNotice) message).getBody(), clock.instant()));
            case DOC_CONTENT, USER_JOINED, USER_LEFT, AUTH, UNAUTHORIZED ->
                log.debug("Ignoring server-only {} frame from {}", message.getType(), self.getName());
        }
    }

    private void reply(Envelope envelope) throws IOException {
        ProtocolIO.sendMessage(socket, envelope);
    }

    private void startSender(Participant owner) {
        activeLoops.incrementAndGet();
        Thread senderThread = new Thread(() -> senderLoop(owner.getOutbox()),
            "connection-" + connectionId + "-sender");
        senderThread.setDaemon(true);
        senderThread.start();
    }

    private void senderLoop(Outbox outbox) {
        try {
            while (!outbox.isDrained()) {
                Envelope msg = outbox.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (msg != null) {
                    ProtocolIO.sendMessage(socket, msg);
                }
            }
            log.debug("Outbox closed for connection {}", connectionId);
            state = ConnectionState.DRAINING;
            ProtocolIO.sendClose(socket);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("Connection {} write error: {}", connectionId, e.getMessage());
        } finally {
            closeSocket();
            loopExited();
        }
    }

    private void unregister() {
        try {
            router.unregister(participant);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted before unregistering {}", participant.getName());
            participant.getOutbox().close();
        }
    }

    private void loopExited() {
        if (activeLoops.decrementAndGet() == 0) {
            closeSocket();
            state = ConnectionState.CLOSED;
            onClosed.accept(this);
            closed.countDown();
            log.debug("Connection {} closed", connectionId);
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Connection {}: error closing socket: {}", connectionId, e.getMessage());
        }
    }
}
