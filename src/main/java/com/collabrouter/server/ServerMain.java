package com.collabrouter.server;

import com.collabrouter.server.auth.HmacTokenAuthenticator;
import com.collabrouter.server.store.DocumentStore;
import com.collabrouter.server.store.InMemoryDocumentStore;
import com.collabrouter.server.store.InMemoryMessageStore;
import com.collabrouter.server.store.JsonFileDocumentStore;
import com.collabrouter.server.store.JsonLinesMessageStore;
import com.collabrouter.server.store.MessageStore;
import com.collabrouter.server.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Usage: {@code ServerMain [port]} or {@code ServerMain issue-token <name>}.
 */
public class ServerMain {

    private static final Logger log = LoggerFactory.getLogger(ServerMain.class);

    public static void main(String[] args) throws Exception {
        RouterConfig config = RouterConfig.load();
        if (config.getAuthSecret().isEmpty()) {
            System.err.println("router.auth.secret must be set");
            System.exit(2);
        }
        HmacTokenAuthenticator authenticator = new HmacTokenAuthenticator(config.getAuthSecret());

        if (args.length > 0 && "issue-token".equals(args[0])) {
            if (args.length < 2) {
                System.err.println("Usage: ServerMain issue-token <name>");
                System.exit(2);
            }
            System.out.println(authenticator.issue(args[1], config.getTokenTtl()));
            return;
        }

        if (args.length > 0) {
            try {
                config = config.withPort(Integer.parseInt(args[0]));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid port argument '{}', using {}", args[0], config.getPort());
            }
        }

        MessageStore messageStore;
        DocumentStore documentStore;
        if (config.getStorageDir().isPresent()) {
            Path dir = config.getStorageDir().get();
            try {
                messageStore = new JsonLinesMessageStore(dir.resolve("messages.jsonl"));
                documentStore = new JsonFileDocumentStore(dir.resolve("documents.json"));
            } catch (StoreException e) {
                log.error("Failed to initialize storage in {}", dir, e);
                System.exit(1);
                return;
            }
            log.info("Using file storage in {}", dir.toAbsolutePath());
        } else {
            messageStore = new InMemoryMessageStore();
            documentStore = new InMemoryDocumentStore();
            log.info("Using in-memory storage");
        }

        Router router = new Router(messageStore, config.getInboxCapacity(), config.getHistoryLimit(),
            Clock.systemUTC());
        RouterServer server = new RouterServer(config, router, authenticator, documentStore);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "router-shutdown"));
        server.start();
        server.awaitTermination();
    }
}
