package com.collabrouter.server;

import com.collabrouter.server.auth.Authenticator;
import com.collabrouter.server.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts TCP connections and hands each one to a {@link ClientConnection} on the client
 * pool. Owns the router's lifecycle.
 */
public class RouterServer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RouterServer.class);

    private final RouterConfig config;
    private final Router router;
    private final Authenticator authenticator;
    private final DocumentSessionHandler documentHandler;
    private final Clock clock;

    private final AtomicLong connectionIdSeq = new AtomicLong(1);
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();
    private final ExecutorService clientPool = Executors.newCachedThreadPool();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean running;
    private ServerSocket serverSocket;

    public RouterServer(RouterConfig config, Router router, Authenticator authenticator, DocumentStore documentStore) {
        this(config, router, authenticator, documentStore, Clock.systemUTC());
    }

    public RouterServer(RouterConfig config, Router router, Authenticator authenticator,
                        DocumentStore documentStore, Clock clock) {
        this.config = config;
        this.router = router;
        this.authenticator = authenticator;
        this.documentHandler = new DocumentSessionHandler(documentStore, router);
        this.clock = clock;
    }

    /**
     * Binds the listening socket, starts the router and the accept thread.
     */
    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(config.getPort());
        running = true;
        router.start();
        Thread acceptor = new Thread(this, "router-accept");
        acceptor.start();
        log.info("Server listening on port {}", getLocalPort());
    }

    public int getLocalPort() {
        return serverSocket.getLocalPort();
    }

    public int getConnectionCount() {
        return connections.size();
    }

    List<ClientConnection> connections() {
        return new ArrayList<>(connections);
    }

    @Override
    public void run() {
        try {
            while (running) {
                Socket socket = serverSocket.accept();
                long id = connectionIdSeq.getAndIncrement();
                ClientConnection connection = new ClientConnection(id, socket, router, authenticator,
                    documentHandler, config, clock, connections::remove);
                connections.add(connection);
                log.debug("Accepted connection {} from {}", id, socket.getRemoteSocketAddress());
                clientPool.submit(connection);
            }
        } catch (IOException e) {
            if (running) {
                log.error("Server error", e);
            }
        } finally {
            shutdown();
        }
    }

    public void shutdown() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        log.info("Shutting down, closing {} connections", connections.size());
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.debug("Error closing server socket: {}", e.getMessage());
        }
        for (ClientConnection connection : new ArrayList<>(connections)) {
            connection.close();
        }
        clientPool.shutdownNow();
        router.stop();
        terminated.countDown();
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }
}
