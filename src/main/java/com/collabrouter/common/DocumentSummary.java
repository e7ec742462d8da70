package com.collabrouter.common;

import java.time.Instant;
import java.util.Objects;

/**
 * Listing entry for a document: everything but the content.
 */
public class DocumentSummary {

    private final String id;
    private final String name;
    private final String language;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    public DocumentSummary(String id, String name, String language,
                           String createdBy, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
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
}
