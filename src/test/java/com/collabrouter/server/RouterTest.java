package com.collabrouter.server;

import com.collabrouter.common.Envelope;
import com.collabrouter.server.store.InMemoryMessageStore;
import com.collabrouter.server.store.MessageStore;
import com.collabrouter.server.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Routing decisions of the hub, driven one event at a time on the test thread.
 * No sockets and no router thread are involved.
 */
public class RouterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryMessageStore store;
    private Router router;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        router = newRouter(store);
    }

    private static Router newRouter(MessageStore messageStore) {
        return new Router(messageStore, 64, 50, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Participant register(String name) {
        return register(name, Outbox.DEFAULT_CAPACITY);
    }

    private Participant register(String name, int capacity) {
        Participant p = new Participant(name, new Outbox(capacity));
        router.handle(new RouterEvent.Register(p));
        return p;
    }

    private static List<Envelope> drain(Participant p) {
        List<Envelope> result = new ArrayList<>();
        try {
            Envelope e;
            while ((e = p.getOutbox().poll(0, TimeUnit.MILLISECONDS)) != null) {
                result.add(e);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail("interrupted");
        }
        return result;
    }

    private static void drainAll(Participant... ps) {
        for (Participant p : ps) {
            drain(p);
        }
    }

    private static <T extends Envelope> List<T> only(List<Envelope> envelopes, Class<T> type) {
        return envelopes.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    private void broadcast(String sender, String body) {
        router.handle(new RouterEvent.RouteBroadcast(new Envelope.Broadcast(sender, body, NOW)));
    }

    private void attach(Participant p, String documentId) {
        router.handle(new RouterEvent.AttachDocument(p, documentId));
    }

    @Test
    void everyoneReceivesBroadcastWithFullNameList() {
        Participant a = register("A");
        Participant b = register("B");
        Participant c = register("C");
        drainAll(a, b, c);

        broadcast("A", "hi");

        for (Participant p : List.of(a, b, c)) {
            List<Envelope> received = drain(p);
            assertEquals(1, received.size(), "envelopes for " + p.getName());
            Envelope.Broadcast msg = (Envelope.Broadcast) received.get(0);
            assertEquals("hi", msg.getBody());
            assertEquals("A", msg.getSender());
            assertEquals(Set.of("A", "B", "C"), Set.copyOf(msg.getUserList()));
            assertEquals(3, msg.getUserList().size());
        }
    }

    @Test
    void nameListTracksRegistrationsAndDepartures() {
        Participant a = register("A");
        Participant b = register("B");
        Participant c = register("C");
        router.handle(new RouterEvent.Unregister(b));
        Participant d = register("D");
        router.handle(new RouterEvent.Unregister(a));
        drainAll(c, d);

        broadcast("C", "who is here");

        Envelope.Broadcast msg = (Envelope.Broadcast) drain(c).get(0);
        assertEquals(List.of("C", "D"), msg.getUserList());
        assertEquals(List.of("C", "D"), router.registry().names());
    }

    @Test
    void joinAndLeaveNoticesGoToEveryone() {
        Participant a = register("A");
        List<Envelope> first = drain(a);
        Envelope.SystemNotice joined = only(first, Envelope.SystemNotice.class).get(0);
        assertEquals("A joined the chat", joined.getBody());
        assertEquals(List.of("A"), joined.getUserList());

        Participant b = register("B");
        drainAll(b);
        Envelope.SystemNotice bJoined = only(drain(a), Envelope.SystemNotice.class).get(0);
        assertEquals(List.of("A", "B"), bJoined.getUserList());

        router.handle(new RouterEvent.Unregister(b));
        Envelope.SystemNotice left = only(drain(a), Envelope.SystemNotice.class).get(0);
        assertEquals("B left the chat", left.getBody());
        assertEquals(List.of("A"), left.getUserList());
        assertTrue(b.getOutbox().isClosed());
    }

    @Test
    void unregisteringDocumentMemberNotifiesRemainingMembersOnce() {
        Participant a = register("A");
        Participant b = register("B");
        Participant c = register("C");
        Participant outsider = register("D");
        attach(a, "doc-1");
        attach(b, "doc-1");
        attach(c, "doc-1");
        drainAll(a, b, c, outsider);

        router.handle(new RouterEvent.Unregister(a));

        for (Participant p : List.of(b, c)) {
            List<Envelope.UserLeft> left = only(drain(p), Envelope.UserLeft.class);
            assertEquals(1, left.size());
            assertEquals("A", left.get(0).getWho());
            assertEquals("doc-1", left.get(0).getDocumentId());
        }
        assertTrue(only(drain(outsider), Envelope.UserLeft.class).isEmpty());
        assertEquals(2, router.registry().members("doc-1").size());
    }

    @Test
    void privateMessageEchoesToSenderAndReachesRecipient() {
        Participant a = register("A");
        Participant b = register("B");
        Participant c = register("C");
        drainAll(a, b, c);

        router.handle(new RouterEvent.RoutePrivate(new Envelope.Private("A", "B", "psst", NOW)));

        List<Envelope> toA = drain(a);
        List<Envelope> toB = drain(b);
        assertEquals(1, toA.size());
        assertEquals(1, toB.size());
        assertEquals("psst", ((Envelope.Private) toA.get(0)).getBody());
        assertEquals("psst", ((Envelope.Private) toB.get(0)).getBody());
        assertTrue(drain(c).isEmpty());
    }

    @Test
    void privateMessageToOfflineNameReportsBackToSender() {
        Participant a = register("A");
        Participant b = register("B");
        drainAll(a, b);

        router.handle(new RouterEvent.RoutePrivate(new Envelope.Private("A", "Zed", "hello?", NOW)));

        List<Envelope> toA = drain(a);
        assertEquals(2, toA.size());
        assertInstanceOf(Envelope.Private.class, toA.get(0));
        List<Envelope.SystemNotice> notices = only(toA, Envelope.SystemNotice.class);
        assertEquals(1, notices.size());
        assertEquals("User 'Zed' is not online", notices.get(0).getBody());
        assertTrue(drain(b).isEmpty());
    }

    @Test
    void privateMessageToSelfIsDeliveredOnce() {
        Participant a = register("A");
        drainAll(a);

        router.handle(new RouterEvent.RoutePrivate(new Envelope.Private("A", "A", "note to self", NOW)));

        assertEquals(1, drain(a).size());
    }

    @Test
    void chatTrafficIsPersisted() throws StoreException {
        register("A");
        register("B");

        broadcast("A", "one");
        router.handle(new RouterEvent.RoutePrivate(new Envelope.Private("A", "B", "two", NOW)));

        List<Envelope> saved = store.fetchRecent(10);
        assertEquals(2, saved.size());
        assertEquals("one", ((Envelope.Broadcast) saved.get(0)).getBody());
        assertEquals("two", ((Envelope.Private) saved.get(1)).getBody());
    }

    @Test
    void documentEditReachesOtherMembersButNeverTheSender() {
        Participant p = register("P");
        Participant q = register("Q");
        Participant r = register("R");
        Participant elsewhere = register("S");
        attach(p, "doc-1");
        attach(q, "doc-1");
        attach(r, "doc-1");
        attach(elsewhere, "doc-2");
        drainAll(p, q, r, elsewhere);

        router.handle(new RouterEvent.RouteDocumentEdit(new Envelope.DocumentEdit("doc-1", "P", "new text")));

        assertTrue(drain(p).isEmpty());
        assertTrue(drain(elsewhere).isEmpty());
        for (Participant member : List.of(q, r)) {
            List<Envelope> received = drain(member);
            assertEquals(1, received.size());
            Envelope.DocumentEdit edit = (Envelope.DocumentEdit) received.get(0);
            assertEquals("new text", edit.getBody());
            assertEquals("P", edit.getSender());
        }
    }

    @Test
    void attachingAnnouncesJoinWithStableColor() {
        Participant a = register("A");
        Participant b = register("B");
        attach(a, "doc-1");
        drainAll(a, b);

        attach(b, "doc-1");

        List<Envelope.UserJoined> joined = only(drain(a), Envelope.UserJoined.class);
        assertEquals(1, joined.size());
        assertEquals("B", joined.get(0).getWho());
        assertEquals(UserColors.colorFor("B"), joined.get(0).getColor());
        assertTrue(drain(b).isEmpty());
    }

    @Test
    void openingSecondDocumentDetachesFromFirst() {
        Participant a = register("A");
        Participant b = register("B");
        attach(a, "doc-1");
        attach(b, "doc-1");
        drainAll(a, b);

        attach(b, "doc-2");

        List<Envelope.UserLeft> left = only(drain(a), Envelope.UserLeft.class);
        assertEquals(1, left.size());
        assertEquals("B", left.get(0).getWho());
        assertEquals(List.of(a), router.registry().members("doc-1"));
        assertEquals(List.of(b), router.registry().members("doc-2"));

        router.handle(new RouterEvent.RouteDocumentEdit(new Envelope.DocumentEdit("doc-1", "A", "x")));
        assertTrue(drain(b).isEmpty());
    }

    @Test
    void reopeningSameDocumentChangesNothing() {
        Participant a = register("A");
        Participant b = register("B");
        attach(a, "doc-1");
        attach(b, "doc-1");
        drainAll(a, b);

        attach(b, "doc-1");

        assertTrue(drain(a).isEmpty());
        assertEquals(2, router.registry().members("doc-1").size());
    }

    @Test
    void fullOutboxOnBroadcastEvictsParticipantSilently() {
        Participant a = register("A");
        Participant slow = register("X", 2);
        Participant b = register("B");
        drainAll(a, b);
        attach(slow, "doc-1");
        attach(b, "doc-1");
        drainAll(a, b);
        assertFalse(slow.getOutbox().offer(new Envelope.SystemNotice("filler", NOW)));

        broadcast("A", "flood");

        assertNull(router.registry().find("X"));
        assertTrue(slow.getOutbox().isClosed());
        assertEquals(List.of(b), router.registry().members("doc-1"));

        List<Envelope> toA = drain(a);
        assertEquals("flood", ((Envelope.Broadcast) toA.get(0)).getBody());
        List<Envelope.SystemNotice> notices = only(toA, Envelope.SystemNotice.class);
        assertEquals(1, notices.size());
        assertEquals("X was disconnected", notices.get(0).getBody());
        assertEquals(List.of("A", "B"), notices.get(0).getUserList());

        List<Envelope> toB = drain(b);
        assertEquals(1, only(toB, Envelope.UserLeft.class).size());
    }

    @Test
    void laterUnregisterOfEvictedParticipantIsIgnored() {
        Participant a = register("A");
        Participant slow = register("X", 1);
        drainAll(a);
        broadcast("A", "first");
        broadcast("A", "second");
        assertNull(router.registry().find("X"));
        drainAll(a);

        router.handle(new RouterEvent.Unregister(slow));

        assertTrue(drain(a).isEmpty());
        assertEquals(List.of("A"), router.registry().names());
    }

    @Test
    void fullOutboxOnPrivateMessageDropsWithoutEviction() {
        Participant a = register("A");
        Participant slow = register("X", 1);
        drainAll(a);

        router.handle(new RouterEvent.RoutePrivate(new Envelope.Private("A", "X", "hello", NOW)));

        assertNotNull(router.registry().find("X"));
        assertFalse(slow.getOutbox().isClosed());
        assertEquals(1, drain(a).size());
    }

    @Test
    void duplicateNameIsRejected() {
        Participant first = register("A");
        drainAll(first);

        Participant second = register("A");

        assertSame(first, router.registry().find("A"));
        assertTrue(second.getOutbox().isClosed());
        List<Envelope> toSecond = drain(second);
        assertEquals(1, toSecond.size());
        assertTrue(((Envelope.SystemNotice) toSecond.get(0)).getBody().contains("already connected"));
        assertTrue(drain(first).isEmpty());

        router.handle(new RouterEvent.Unregister(second));
        assertSame(first, router.registry().find("A"));
        assertFalse(first.getOutbox().isClosed());
    }

    @Test
    void newcomerReceivesRecentHistoryWithoutOthersPrivateMessages() throws StoreException {
        store.persist(new Envelope.Broadcast("A", "old news", NOW));
        store.persist(new Envelope.Private("A", "B", "secret", NOW));
        store.persist(new Envelope.Private("A", "N", "for the newcomer", NOW));

        Participant n = register("N");

        List<Envelope> received = drain(n);
        assertEquals(3, received.size());
        Envelope.Broadcast history = (Envelope.Broadcast) received.get(0);
        assertEquals("old news", history.getBody());
        assertEquals(List.of("N"), history.getUserList());
        assertEquals("for the newcomer", ((Envelope.Private) received.get(1)).getBody());
        assertEquals("N joined the chat", ((Envelope.SystemNotice) received.get(2)).getBody());
    }

    @Test
    void historyIsLimitedToNewestMessages() throws StoreException {
        for (int i = 0; i < 60; i++) {
            store.persist(new Envelope.Broadcast("A", "m" + i, NOW));
        }

        Participant n = register("N");

        List<Envelope.Broadcast> history = only(drain(n), Envelope.Broadcast.class);
        assertEquals(50, history.size());
        assertEquals("m10", history.get(0).getBody());
        assertEquals("m59", history.get(49).getBody());
    }

    @Test
    void storeFailuresNeitherBlockRegistrationNorDelivery() {
        router = newRouter(new MessageStore() {
            @Override
            public void persist(Envelope envelope) throws StoreException {
                throw new StoreException("disk full");
            }

            @Override
            public List<Envelope> fetchRecent(int limit) throws StoreException {
                throw new StoreException("disk gone");
            }
        });
        Participant a = register("A");
        Participant b = register("B");
        assertEquals(List.of("A", "B"), router.registry().names());
        drainAll(a, b);

        broadcast("A", "still works");

        assertEquals("still works", ((Envelope.Broadcast) drain(b).get(0)).getBody());
    }

    @Test
    void documentsChangedSendsRefreshToEveryone() {
        Participant a = register("A");
        Participant b = register("B");
        drainAll(a, b);

        router.handle(new RouterEvent.DocumentsChanged());

        for (Participant p : List.of(a, b)) {
            List<Envelope> received = drain(p);
            assertEquals(1, received.size());
            assertTrue(((Envelope.DocumentList) received.get(0)).getDocuments().isEmpty());
        }
    }

    @Test
    void attachOfUnregisteredParticipantIsIgnored() {
        Participant ghost = new Participant("ghost", new Outbox());

        attach(ghost, "doc-1");

        assertTrue(router.registry().members("doc-1").isEmpty());
    }

    @Test
    void runLoopProcessesSubmittedEventsInOrder() throws Exception {
        router.start();
        try {
            Participant a = new Participant("A", new Outbox());
            router.register(a);
            router.routeBroadcast(new Envelope.Broadcast("A", "one", NOW));
            router.routeBroadcast(new Envelope.Broadcast("A", "two", NOW));

            List<String> bodies = new ArrayList<>();
            while (bodies.size() < 3) {
                Envelope e = a.getOutbox().poll(5, TimeUnit.SECONDS);
                assertNotNull(e, "timed out waiting for router");
                if (e instanceof Envelope.Broadcast) {
                    bodies.add(((Envelope.Broadcast) e).getBody());
                } else {
                    bodies.add(((Envelope.SystemNotice) e).getBody());
                }
            }
            assertEquals(List.of("A joined the chat", "one", "two"), bodies);
        } finally {
            router.stop();
        }
    }
}
