package com.collabrouter.server;

import com.collabrouter.common.Envelope;
import com.collabrouter.server.store.MessageStore;
import com.collabrouter.server.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * The hub. Owns the {@link MembershipRegistry} and makes every routing decision on one
 * thread, consuming {@link RouterEvent}s from a single bounded queue in arrival order.
 * Nothing else touches membership state, so none of it is locked.
 *
 * Delivery into participant outboxes never blocks. A full outbox during a broadcast
 * evicts that participant; on every other path the envelope is dropped and logged.
 */
public class Router implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    public static final int DEFAULT_INBOX_CAPACITY = 1024;
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final BlockingQueue<RouterEvent> inbox;
    private final MembershipRegistry registry = new MembershipRegistry();
    private final MessageStore messageStore;
    private final int historyLimit;
    private final Clock clock;

    private volatile boolean running;
    private Thread thread;

    public Router(MessageStore messageStore) {
        this(messageStore, DEFAULT_INBOX_CAPACITY, DEFAULT_HISTORY_LIMIT, Clock.systemUTC());
    }

    public Router(MessageStore messageStore, int inboxCapacity, int historyLimit, Clock clock) {
        this.messageStore = messageStore;
        this.inbox = new LinkedBlockingQueue<>(inboxCapacity);
        this.historyLimit = historyLimit;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this, "router");
        thread.setDaemon(true);
        thread.start();
        log.info("Router started (history limit {})", historyLimit);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Router stopped");
    }

    /**
     * Queues an event, blocking while the inbox is full.
     */
    public void submit(RouterEvent event) throws InterruptedException {
        inbox.put(event);
    }

    public void register(Participant participant) throws InterruptedException {
        submit(new RouterEvent.Register(participant));
    }

    public void unregister(Participant participant) throws InterruptedException {
        submit(new RouterEvent.Unregister(participant));
    }

    public void routeBroadcast(Envelope.Broadcast message) throws InterruptedException {
        submit(new RouterEvent.RouteBroadcast(message));
    }

    public void routePrivate(Envelope.Private message) throws InterruptedException {
        submit(new RouterEvent.RoutePrivate(message));
    }

    public void routeDocumentEdit(Envelope.DocumentEdit edit) throws InterruptedException {
        submit(new RouterEvent.RouteDocumentEdit(edit));
    }

    public void attachDocument(Participant participant, String documentId) throws InterruptedException {
        submit(new RouterEvent.AttachDocument(participant, documentId));
    }

    public void documentsChanged() throws InterruptedException {
        submit(new RouterEvent.DocumentsChanged());
    }

    @Override
    public void run() {
        while (running) {
            RouterEvent event;
            try {
                event = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                handle(event);
            } catch (RuntimeException e) {
                log.error("Failed to handle {} event", event.getType(), e);
            }
        }
    }

    void handle(RouterEvent event) {
        switch (event.getType()) {
            case REGISTER -> handleRegister(((RouterEvent.Register) event).getParticipant());
            case UNREGISTER -> handleUnregister(((RouterEvent.Unregister) event).getParticipant());
            case BROADCAST -> handleBroadcast(((RouterEvent.RouteBroadcast) event).getMessage());
            case PRIVATE -> handlePrivate(((RouterEvent.RoutePrivate) event).getMessage());
            case DOCUMENT_EDIT -> handleDocumentEdit(((RouterEvent.RouteDocumentEdit) event).getEdit());
            case ATTACH_DOCUMENT -> {
                RouterEvent.AttachDocument attach = (RouterEvent.AttachDocument) event;
                handleAttach(attach.getParticipant(), attach.getDocumentId());
            }
            case DOCUMENTS_CHANGED -> handleDocumentsChanged();
        }
    }

    MembershipRegistry registry() {
        return registry;
    }

    private void handleRegister(Participant participant) {
        if (!registry.add(participant)) {
            log.warn("Rejecting {}: name already connected", participant.getName());
            participant.getOutbox().offer(new Envelope.SystemNotice(
                "Name '" + participant.getName() + "' is already connected", clock.instant()));
            participant.getOutbox().close();
            return;
        }
        log.info("Participant {} connected. Total participants {}", participant.getName(), registry.size());

        sendHistory(participant);
        broadcastNotice(participant.getName() + " joined the chat");
    }

    // Best-effort: a failed fetch or a full outbox only costs the newcomer some history.
    private void sendHistory(Participant participant) {
        List<Envelope> history;
        try {
            history = messageStore.fetchRecent(historyLimit);
        } catch (StoreException e) {
            log.warn("Failed to get message history for {}: {}", participant.getName(), e.getMessage());
            return;
        }
        List<String> names = registry.names();
        for (Envelope message : history) {
            Envelope stamped = message;
            if (message instanceof Envelope.Private) {
                if (!((Envelope.Private) message).involves(participant.getName())) {
                    continue;
                }
            } else if (message instanceof Envelope.Broadcast) {
                stamped = ((Envelope.Broadcast) message).withUserList(names);
            }
            if (!participant.getOutbox().offer(stamped)) {
                log.warn("Failed to send history to {}: outbox full", participant.getName());
                return;
            }
        }
    }

    private void handleUnregister(Participant participant) {
        participant.getOutbox().close();
        if (!registry.remove(participant)) {
            log.debug("Ignoring unregister of {}: not registered", participant.getName());
            return;
        }
        log.info("Participant {} disconnected. Total participants {}", participant.getName(), registry.size());
        leaveDocument(participant);
        broadcastNotice(participant.getName() + " left the chat");
    }

    private void handleBroadcast(Envelope.Broadcast message) {
        log.debug("Broadcasting message from {}", message.getSender());
        persist(message);
        fanOut(message::withUserList);
    }

    private void handlePrivate(Envelope.Private message) {
        log.debug("Routing private message from {} to {}", message.getFrom(), message.getTo());
        persist(message);

        Participant sender = registry.find(message.getFrom());
        Participant recipient = registry.find(message.getTo());
        if (sender != null) {
            deliver(sender, message);
        }
        if (recipient != null) {
            if (recipient != sender) {
                deliver(recipient, message);
            }
        } else if (sender != null) {
            deliver(sender, new Envelope.SystemNotice(
                "User '" + message.getTo() + "' is not online", clock.instant()));
        }
    }

    private void handleDocumentEdit(Envelope.DocumentEdit edit) {
        log.debug("Routing edit for document {} from {}", edit.getDocumentId(), edit.getSender());
        for (Participant member : registry.members(edit.getDocumentId())) {
            if (!member.getName().equals(edit.getSender())) {
                deliver(member, edit);
            }
        }
    }

    private void handleAttach(Participant participant, String documentId) {
        if (!registry.contains(participant)) {
            log.debug("Ignoring attach of {} to {}: not registered", participant.getName(), documentId);
            return;
        }
        if (documentId.equals(participant.getCurrentDocumentId())) {
            return;
        }
        leaveDocument(participant);
        registry.attach(participant, documentId);
        log.info("{} attached to document {}", participant.getName(), documentId);

        Envelope joined = new Envelope.UserJoined(documentId, participant.getName(),
            UserColors.colorFor(participant.getName()));
        for (Participant member : registry.members(documentId)) {
            if (member != participant) {
                deliver(member, joined);
            }
        }
    }

    private void handleDocumentsChanged() {
        Envelope refresh = new Envelope.DocumentList();
        for (Participant participant : registry.participants()) {
            deliver(participant, refresh);
        }
    }

    private void broadcastNotice(String body) {
        fanOut(names -> new Envelope.SystemNotice(body, clock.instant(), names));
    }

    /**
     * Sends a broadcast-class envelope to everyone, stamped with the current name list.
     * Participants whose outbox is full are evicted and announced afterwards.
     */
    private void fanOut(Function<List<String>, Envelope> withNames) {
        Envelope message = withNames.apply(registry.names());
        List<Participant> evicted = new ArrayList<>();
        for (Participant participant : registry.participants()) {
            if (!participant.getOutbox().offer(message)) {
                evicted.add(participant);
            }
        }
        for (Participant participant : evicted) {
            evict(participant);
        }
        for (Participant participant : evicted) {
            broadcastNotice(participant.getName() + " was disconnected");
        }
    }

    private void evict(Participant participant) {
        log.warn("Outbox of {} is full ({} queued), closing connection",
            participant.getName(), participant.getOutbox().size());
        participant.getOutbox().close();
        registry.remove(participant);
        leaveDocument(participant);
    }

    private void leaveDocument(Participant participant) {
        String documentId = registry.detach(participant);
        if (documentId == null) {
            return;
        }
        Envelope left = new Envelope.UserLeft(documentId, participant.getName());
        for (Participant member : registry.members(documentId)) {
            deliver(member, left);
        }
    }

    private void deliver(Participant participant, Envelope envelope) {
        if (!participant.getOutbox().offer(envelope)) {
            log.warn("Dropped {} for {}: outbox full or closed", envelope.getType(), participant.getName());
        }
    }

    private void persist(Envelope message) {
        try {
            messageStore.persist(message);
        } catch (StoreException e) {
            log.warn("Failed to save {} message: {}", message.getType(), e.getMessage());
        }
    }
}
