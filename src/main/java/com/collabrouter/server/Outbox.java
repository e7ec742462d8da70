package com.collabrouter.server;

import com.collabrouter.common.Envelope;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, closable queue of envelopes waiting to be written to one participant.
 * The router is the only producer and the only one that closes it; the connection's
 * outbound loop is the only consumer.
 */
public class Outbox {

    public static final int DEFAULT_CAPACITY = 256;

    private final BlockingQueue<Envelope> queue;
    private final int capacity;
    private volatile boolean closed;

    public Outbox() {
        this(DEFAULT_CAPACITY);
    }

    public Outbox(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Outbox capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Never blocks.
     *
     * @return false if the outbox is full or closed
     */
    public boolean offer(Envelope envelope) {
        if (closed) {
            return false;
        }
        return queue.offer(envelope);
    }

    public Envelope poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Envelopes already queued stay available to the consumer; nothing new is accepted.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Closed and nothing left to write. */
    public boolean isDrained() {
        return closed && queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
