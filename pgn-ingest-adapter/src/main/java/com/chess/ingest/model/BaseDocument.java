package com.chess.ingest.model;

import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Base class for stored entities that are created once and then updated in place.
 */
public abstract class BaseDocument {

    @Id
    private String id;

    /**
     * When this document was first written
     */
    private Instant createdAt;

    /**
     * When this document was last updated
     */
    private Instant updatedAt;

    public BaseDocument() {
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
