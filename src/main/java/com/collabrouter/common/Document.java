package com.collabrouter.common;

import java.time.Instant;
import java.util.Objects;

/**
 * A shared document as held by the document store. The router itself never keeps
 * document content, only which participants are attached to which document id.
 */
public class Document {

    private final String id;
    private final String name;
    private final String content;
    private final String language;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    public Document(String id, String name, String content, String language,
                    String createdBy, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.content = content == null ? "" : content;
        this.language = language;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    public String getLanguage() {
        return language;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Document withContent(String newContent, Instant now) {
        return new Document(id, name, newContent, language, createdBy, createdAt, now);
    }

    public DocumentSummary toSummary() {
        return new DocumentSummary(id, name, language, createdBy, createdAt, updatedAt);
    }
}
