package com.skillmap.catalog.repository;

import com.skillmap.catalog.model.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.util.UUID;

/**
 * CRUD + filtered listing for the topics table.
 *
 * Search and parent filters are optional, so listings go through
 * {@link JpaSpecificationExecutor} rather than derived query methods.
 */
public interface TopicRepository extends JpaRepository<Topic, UUID>, JpaSpecificationExecutor<Topic> {

    /**
     * Clear the parent reference of every child of a topic about to be deleted.
     * Mirrors the ON DELETE SET NULL constraint for rows already loaded in the
     * persistence context.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Topic t SET t.parentTopicId = NULL WHERE t.parentTopicId = :parentId")
    int detachChildren(UUID parentId);
}
