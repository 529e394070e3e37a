package com.skillmap.catalog.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A node of the topic taxonomy.
 *
 * A Topic may point at a parent Topic; the hierarchy is kept by reference
 * only (no JPA relationship), so loading a Topic never pulls its ancestors
 * or its skills.
 *
 * DB table: topics  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "topics")
public class Topic {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Null for root topics. The FK is ON DELETE SET NULL.
    @Column(name = "parent_topic_id")
    private UUID parentTopicId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Topic() {}   // required by JPA

    public Topic(String name, String description, UUID parentTopicId) {
        this.name          = name;
        this.description   = description;
        this.parentTopicId = parentTopicId;
    }

    /** For stores that assign identifiers and timestamps themselves. */
    public Topic(UUID id, String name, String description, UUID parentTopicId,
                 Instant createdAt, Instant updatedAt) {
        this(name, description, parentTopicId);
        this.id        = id;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID    getId()            { return id; }
    public String  getName()          { return name; }
    public String  getDescription()   { return description; }
    public UUID    getParentTopicId() { return parentTopicId; }
    public Instant getCreatedAt()     { return createdAt; }
    public Instant getUpdatedAt()     { return updatedAt; }

    public void setName(String name)                 { this.name = name; }
    public void setDescription(String description)   { this.description = description; }
    public void setParentTopicId(UUID parentTopicId) { this.parentTopicId = parentTopicId; }
}
