package com.collabrouter.server.store;

import com.collabrouter.common.Envelope;

import java.util.ArrayList;
import java.util.List;

public class InMemoryMessageStore implements MessageStore {

    private final List<Envelope> messages = new ArrayList<>();

    @Override
    public synchronized void persist(Envelope envelope) {
        messages.add(envelope);
    }

    @Override
    public synchronized List<Envelope> fetchRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, messages.size() - limit);
        return List.copyOf(messages.subList(from, messages.size()));
    }
}
