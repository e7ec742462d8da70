package com.collabrouter.server;

import com.collabrouter.common.Document;
import com.collabrouter.common.DocumentSummary;
import com.collabrouter.common.Envelope;
import com.collabrouter.server.store.DocumentStore;
import com.collabrouter.server.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Document requests, run on the requesting connection's inbound thread. Answers go
 * straight back on that connection; membership changes go through the router.
 * Store failures are logged and the request is dropped without telling the client.
 */
public class DocumentSessionHandler {

    private static final Logger log = LoggerFactory.getLogger(DocumentSessionHandler.class);

    /**
     * Direct write to the requesting connection, bypassing its outbox.
     */
    @FunctionalInterface
    public interface Reply {
        void send(Envelope envelope) throws IOException;
    }

    private final DocumentStore store;
    private final Router router;

    public DocumentSessionHandler(DocumentStore store, Router router) {
        this.store = store;
        this.router = router;
    }

    public void handleList(Participant participant, Reply reply) throws IOException {
        List<DocumentSummary> documents;
        try {
            documents = store.listDocuments();
        } catch (StoreException e) {
            log.warn("Error listing documents for {}: {}", participant.getName(), e.getMessage());
            return;
        }
        reply.send(new Envelope.DocumentList(documents));
    }

    public void handleOpen(Participant participant, String documentId, Reply reply)
        throws IOException, InterruptedException {
        if (documentId == null || documentId.isBlank()) {
            log.debug("{} sent doc-open without a document id", participant.getName());
            return;
        }
        Optional<Document> doc;
        try {
            doc = store.getDocument(documentId);
        } catch (StoreException e) {
            log.warn("Error getting document {}: {}", documentId, e.getMessage());
            return;
        }
        if (doc.isEmpty()) {
            log.info("Document {} not found", documentId);
            return;
        }
        reply.send(new Envelope.DocumentContent(doc.get()));
        router.attachDocument(participant, documentId);
        log.info("{} opened document {}", participant.getName(), doc.get().getName());
    }

    public void handleCreate(Participant participant, String name, String language, Reply reply)
        throws IOException, InterruptedException {
        Document doc;
        try {
            doc = store.createDocument(name, language, participant.getName());
        } catch (StoreException e) {
            log.warn("Error creating document for {}: {}", participant.getName(), e.getMessage());
            return;
        }
        log.info("Document created: {} by {}", doc.getName(), participant.getName());
        reply.send(new Envelope.DocumentContent(doc));
        router.attachDocument(participant, doc.getId());
        router.documentsChanged();
    }

    /**
     * The edit body is the full text of the document after the sender's change; it is
     * saved as the new content and then fanned out to the other editors.
     */
    public void handleEdit(Participant participant, Envelope.DocumentEdit edit) throws InterruptedException {
        if (edit.getDocumentId() == null || edit.getDocumentId().isBlank()) {
            log.debug("{} sent doc-update without a document id", participant.getName());
            return;
        }
        try {
            store.updateDocumentContent(edit.getDocumentId(), edit.getBody());
        } catch (StoreException e) {
            log.warn("Error updating document {}: {}", edit.getDocumentId(), e.getMessage());
        }
        router.routeDocumentEdit(edit.withSender(participant.getName()));
    }
}
