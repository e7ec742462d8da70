package com.collabrouter.server.store;

import com.collabrouter.common.Document;
import com.collabrouter.common.DocumentSummary;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryDocumentStore implements DocumentStore {

    static final Comparator<DocumentSummary> NEWEST_FIRST =
        Comparator.comparing(DocumentSummary::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<DocumentSummary> listDocuments() {
        return summarize(documents.values());
    }

    @Override
    public Optional<Document> getDocument(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public Document createDocument(String name, String language, String creator) throws StoreException {
        if (name == null || name.isBlank()) {
            throw new StoreException("Document name is required");
        }
        Instant now = clock.instant();
        String lang = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
        Document doc = new Document(UUID.randomUUID().toString(), name, "", lang, creator, now, now);
        documents.put(doc.getId(), doc);
        return doc;
    }

    @Override
    public void updateDocumentContent(String id, String content) throws StoreException {
        if (id == null || documents.computeIfPresent(id, (key, doc) -> doc.withContent(content, clock.instant())) == null) {
            throw new StoreException("No document with id " + id);
        }
    }

    static List<DocumentSummary> summarize(Collection<Document> docs) {
        return docs.stream()
            .map(Document::toSummary)
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }
}
