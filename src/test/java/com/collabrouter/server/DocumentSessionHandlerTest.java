package com.collabrouter.server;

import com.collabrouter.common.Document;
import com.collabrouter.common.Envelope;
import com.collabrouter.server.store.InMemoryDocumentStore;
import com.collabrouter.server.store.InMemoryMessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Document requests answered directly to the requester, with membership changes
 * observed through a running router.
 */
public class DocumentSessionHandlerTest {

    private InMemoryDocumentStore documents;
    private Router router;
    private DocumentSessionHandler handler;
    private Participant alice;
    private Participant bob;
    private List<Envelope> aliceReplies;
    private List<Envelope> bobReplies;

    @BeforeEach
    void setUp() throws InterruptedException {
        documents = new InMemoryDocumentStore();
        router = new Router(new InMemoryMessageStore());
        router.start();
        handler = new DocumentSessionHandler(documents, router);
        alice = new Participant("alice", new Outbox());
        bob = new Participant("bob", new Outbox());
        aliceReplies = new ArrayList<>();
        bobReplies = new ArrayList<>();
        router.register(alice);
        router.register(bob);
        awaitNotice(alice, "bob joined the chat");
        awaitNotice(bob, "bob joined the chat");
    }

    @AfterEach
    void tearDown() {
        router.stop();
    }

    private static <T extends Envelope> T await(Participant p, Class<T> type) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Envelope e = p.getOutbox().poll(100, TimeUnit.MILLISECONDS);
            if (type.isInstance(e)) {
                return type.cast(e);
            }
        }
        fail("no " + type.getSimpleName() + " for " + p.getName());
        return null;
    }

    private static void awaitNotice(Participant p, String body) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Envelope e = p.getOutbox().poll(100, TimeUnit.MILLISECONDS);
            if (e instanceof Envelope.SystemNotice && ((Envelope.SystemNotice) e).getBody().equals(body)) {
                return;
            }
        }
        fail("no notice '" + body + "' for " + p.getName());
    }

    @Test
    void createRepliesWithContentAttachesCreatorAndRefreshesEveryone() throws Exception {
        handler.handleCreate(alice, "notes.md", "markdown", aliceReplies::add);

        assertEquals(1, aliceReplies.size());
        Document doc = ((Envelope.DocumentContent) aliceReplies.get(0)).getDocument();
        assertEquals("notes.md", doc.getName());
        assertEquals("markdown", doc.getLanguage());
        assertEquals("alice", doc.getCreatedBy());
        assertEquals("", doc.getContent());

        await(alice, Envelope.DocumentList.class);
        await(bob, Envelope.DocumentList.class);

        handler.handleOpen(bob, doc.getId(), bobReplies::add);
        assertEquals(doc.getId(), ((Envelope.DocumentContent) bobReplies.get(0)).getDocument().getId());
        Envelope.UserJoined joined = await(alice, Envelope.UserJoined.class);
        assertEquals("bob", joined.getWho());
        assertEquals(doc.getId(), joined.getDocumentId());
    }

    @Test
    void listRepliesWithSummaries() throws Exception {
        documents.createDocument("a.txt", null, "alice");

        handler.handleList(alice, aliceReplies::add);

        Envelope.DocumentList list = (Envelope.DocumentList) aliceReplies.get(0);
        assertEquals(1, list.getDocuments().size());
        assertEquals("a.txt", list.getDocuments().get(0).getName());
        assertEquals("plaintext", list.getDocuments().get(0).getLanguage());
    }

    @Test
    void openOfUnknownDocumentSendsNothing() throws Exception {
        handler.handleOpen(alice, "missing", aliceReplies::add);

        assertTrue(aliceReplies.isEmpty());
    }

    @Test
    void createWithoutNameSendsNothing() throws Exception {
        handler.handleCreate(alice, " ", "java", aliceReplies::add);

        assertTrue(aliceReplies.isEmpty());
        assertTrue(documents.listDocuments().isEmpty());
    }

    @Test
    void editIsSavedAndForwardedWithServerSideSender() throws Exception {
        Document doc = documents.createDocument("shared.txt", null, "alice");
        handler.handleOpen(alice, doc.getId(), aliceReplies::add);
        handler.handleOpen(bob, doc.getId(), bobReplies::add);
        await(alice, Envelope.UserJoined.class);

        handler.handleEdit(alice, new Envelope.DocumentEdit(doc.getId(), "mallory", "hello world"));

        Envelope.DocumentEdit received = await(bob, Envelope.DocumentEdit.class);
        assertEquals("alice", received.getSender());
        assertEquals("hello world", received.getBody());
        assertEquals("hello world", documents.getDocument(doc.getId()).orElseThrow().getContent());
    }

    @Test
    void editIsRoutedEvenWhenSavingFails() throws Exception {
        router.attachDocument(alice, "not-stored");
        router.attachDocument(bob, "not-stored");
        await(alice, Envelope.UserJoined.class);

        handler.handleEdit(alice, new Envelope.DocumentEdit("not-stored", null, "text"));

        assertEquals("text", await(bob, Envelope.DocumentEdit.class).getBody());
        assertTrue(documents.getDocument("not-stored").isEmpty());
    }
}
