package com.collabrouter.server.store;

import com.collabrouter.common.Document;
import com.collabrouter.common.DocumentSummary;
import com.collabrouter.common.EnvelopeCodec;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Document store that keeps every document in memory and rewrites one JSON file on
 * each change. Suited to the small document counts of a single router instance.
 */
public class JsonFileDocumentStore implements DocumentStore {

    private static final Gson GSON = new Gson();

    private final Path file;
    private final Clock clock;
    private final Map<String, Document> documents = new LinkedHashMap<>();

    public JsonFileDocumentStore(Path file) throws StoreException {
        this(file, Clock.systemUTC());
    }

    public JsonFileDocumentStore(Path file, Clock clock) throws StoreException {
        this.file = file;
        this.clock = clock;
        load();
    }

    @Override
    public synchronized List<DocumentSummary> listDocuments() {
        return InMemoryDocumentStore.summarize(documents.values());
    }

    @Override
    public synchronized Optional<Document> getDocument(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public synchronized Document createDocument(String name, String language, String creator) throws StoreException {
        if (name == null || name.isBlank()) {
            throw new StoreException("Document name is required");
        }
        Instant now = clock.instant();
        String lang = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
        Document doc = new Document(UUID.randomUUID().toString(), name, "", lang, creator, now, now);
        documents.put(doc.getId(), doc);
        save();
        return doc;
    }

    @Override
    public synchronized void updateDocumentContent(String id, String content) throws StoreException {
        Document existing = id == null ? null : documents.get(id);
        if (existing == null) {
            throw new StoreException("No document with id " + id);
        }
        documents.put(id, existing.withContent(content, clock.instant()));
        save();
    }

    private void load() throws StoreException {
        if (!Files.exists(file)) {
            return;
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            JsonElement root = GSON.fromJson(json, JsonElement.class);
            if (root == null || root.isJsonNull()) {
                return;
            }
            if (!root.isJsonArray()) {
                throw new StoreException("Expected a JSON array of documents in " + file);
            }
            for (JsonElement el : root.getAsJsonArray()) {
                Document doc = EnvelopeCodec.decodeDocument(el.getAsJsonObject());
                documents.put(doc.getId(), doc);
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new StoreException("Failed to load documents from " + file, e);
        }
    }

    private void save() throws StoreException {
        JsonArray arr = new JsonArray();
        for (Document doc : documents.values()) {
            arr.add(EnvelopeCodec.encodeDocument(doc));
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, GSON.toJson(arr), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Failed to write documents to " + file, e);
        }
    }
}
