package com.skillmap.catalog.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A skill cataloged under exactly one Topic.
 *
 * DB table: skills  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "skills")
public class Skill {

    public static final String DEFAULT_DIFFICULTY = "beginner";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    // Plain reference; the delete guard in TopicService keeps it valid.
    @Column(name = "topic_id", nullable = false)
    private UUID topicId;

    @Column(nullable = false)
    private String difficulty = DEFAULT_DIFFICULTY;

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

    protected Skill() {}   // required by JPA

    public Skill(String name, UUID topicId, String difficulty) {
        this.name       = name;
        this.topicId    = topicId;
        this.difficulty = difficulty;
    }

    /** For stores that assign identifiers and timestamps themselves. */
    public Skill(UUID id, String name, UUID topicId, String difficulty,
                 Instant createdAt, Instant updatedAt) {
        this(name, topicId, difficulty);
        this.id        = id;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID    getId()         { return id; }
    public String  getName()       { return name; }
    public UUID    getTopicId()    { return topicId; }
    public String  getDifficulty() { return difficulty; }
    public Instant getCreatedAt()  { return createdAt; }
    public Instant getUpdatedAt()  { return updatedAt; }

    public void setName(String name)             { this.name = name; }
    public void setTopicId(UUID topicId)         { this.topicId = topicId; }
    public void setDifficulty(String difficulty) { this.difficulty = difficulty; }
}
