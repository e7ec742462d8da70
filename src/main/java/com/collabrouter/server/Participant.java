package com.collabrouter.server;

import java.util.Objects;

/**
 * A connected, authenticated participant as seen by the router. Identity is the
 * object itself: two connections with the same name are two different participants.
 */
public class Participant {

    private final String name;
    private final Outbox outbox;

    // Only read or written on the router thread.
    private String currentDocumentId;

    public Participant(String name, Outbox outbox) {
        this.name = Objects.requireNonNull(name, "name");
        this.outbox = Objects.requireNonNull(outbox, "outbox");
    }

    public String getName() {
        return name;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    String getCurrentDocumentId() {
        return currentDocumentId;
    }

    void setCurrentDocumentId(String currentDocumentId) {
        this.currentDocumentId = currentDocumentId;
    }

    @Override
    public String toString() {
        return "Participant[" + name + "]";
    }
}
