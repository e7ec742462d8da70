package com.collabrouter.server.store;

import com.collabrouter.common.Envelope;

import java.util.List;

/**
 * Append-only store of chat traffic (broadcast and private messages).
 *
 * Implementations serialize their own internal access; the router calls them from its
 * single thread but connections may read concurrently.
 */
public interface MessageStore {

    void persist(Envelope envelope) throws StoreException;

    /**
     * Returns the newest {@code limit} messages, oldest first.
     */
    List<Envelope> fetchRecent(int limit) throws StoreException;
}
