package com.collabrouter.server;

import com.collabrouter.common.ProtocolIO;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * Server settings. Defaults are overridden by {@code router.properties} on the classpath,
 * which is in turn overridden by JVM system properties with the same keys.
 */
public final class RouterConfig {

    static final String RESOURCE = "/router.properties";

    static final String PORT = "router.port";
    static final String OUTBOX_CAPACITY = "router.outbox.capacity";
    static final String INBOX_CAPACITY = "router.inbox.capacity";
    static final String HISTORY_LIMIT = "router.history.limit";
    static final String MAX_FRAME_BYTES = "router.frame.max-bytes";
    static final String AUTH_SECRET = "router.auth.secret";
    static final String TOKEN_TTL_HOURS = "router.auth.token-ttl-hours";
    static final String STORAGE_DIR = "router.storage.dir";

    private final int port;
    private final int outboxCapacity;
    private final int inboxCapacity;
    private final int historyLimit;
    private final int maxFrameBytes;
    private final String authSecret;
    private final Duration tokenTtl;
    private final Path storageDir;

    private RouterConfig(Properties props) {
        this.port = intValue(props, PORT, 5050, 0, 65535);
        this.outboxCapacity = intValue(props, OUTBOX_CAPACITY, Outbox.DEFAULT_CAPACITY, 1, Integer.MAX_VALUE);
        this.inboxCapacity = intValue(props, INBOX_CAPACITY, Router.DEFAULT_INBOX_CAPACITY, 1, Integer.MAX_VALUE);
        this.historyLimit = intValue(props, HISTORY_LIMIT, Router.DEFAULT_HISTORY_LIMIT, 0, Integer.MAX_VALUE);
        this.maxFrameBytes = intValue(props, MAX_FRAME_BYTES, ProtocolIO.DEFAULT_MAX_FRAME_BYTES, 1, Integer.MAX_VALUE);
        this.authSecret = props.getProperty(AUTH_SECRET, "").trim();
        this.tokenTtl = Duration.ofHours(intValue(props, TOKEN_TTL_HOURS, 24, 1, Integer.MAX_VALUE));
        String dir = props.getProperty(STORAGE_DIR, "").trim();
        this.storageDir = dir.isEmpty() ? null : Path.of(dir);
    }

    public static RouterConfig load() {
        Properties props = new Properties();
        try (InputStream in = RouterConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("router.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return new RouterConfig(props);
    }

    public static RouterConfig fromProperties(Properties props) {
        return new RouterConfig(props);
    }

    public RouterConfig withPort(int newPort) {
        Properties props = toProperties();
        props.setProperty(PORT, Integer.toString(newPort));
        return new RouterConfig(props);
    }

    public int getPort() {
        return port;
    }

    public int getOutboxCapacity() {
        return outboxCapacity;
    }

    public int getInboxCapacity() {
        return inboxCapacity;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public String getAuthSecret() {
        return authSecret;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    /** Empty means in-memory stores. */
    public Optional<Path> getStorageDir() {
        return Optional.ofNullable(storageDir);
    }

    private Properties toProperties() {
        Properties props = new Properties();
        props.setProperty(PORT, Integer.toString(port));
        props.setProperty(OUTBOX_CAPACITY, Integer.toString(outboxCapacity));
        props.setProperty(INBOX_CAPACITY, Integer.toString(inboxCapacity));
        props.setProperty(HISTORY_LIMIT, Integer.toString(historyLimit));
        props.setProperty(MAX_FRAME_BYTES, Integer.toString(maxFrameBytes));
        props.setProperty(AUTH_SECRET, authSecret);
        props.setProperty(TOKEN_TTL_HOURS, Long.toString(tokenTtl.toHours()));
        if (storageDir != null) {
            props.setProperty(STORAGE_DIR, storageDir.toString());
        }
        return props;
    }

    private static int intValue(Properties props, String key, int defaultValue, int min, int max) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + value);
        }
        return value;
    }
}
