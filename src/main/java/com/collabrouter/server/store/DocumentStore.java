package com.collabrouter.server.store;

import com.collabrouter.common.Document;
import com.collabrouter.common.DocumentSummary;

import java.util.List;
import java.util.Optional;

public interface DocumentStore {

    String DEFAULT_LANGUAGE = "plaintext";

    /**
     * All documents, most recently updated first.
     */
    List<DocumentSummary> listDocuments() throws StoreException;

    Optional<Document> getDocument(String id) throws StoreException;

    Document createDocument(String name, String language, String creator) throws StoreException;

    /**
     * Replaces the content and bumps the update time.
     *
     * @throws StoreException if no document has this id
     */
    void updateDocumentContent(String id, String content) throws StoreException;
}
