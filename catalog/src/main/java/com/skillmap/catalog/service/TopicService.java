package com.skillmap.catalog.service;

import com.skillmap.catalog.model.Topic;
import com.skillmap.catalog.service.CatalogException.Reason;
import com.skillmap.catalog.store.CatalogStore;
import com.skillmap.catalog.store.PageWindow;
import com.skillmap.catalog.store.ResultPage;
import com.skillmap.catalog.store.TopicFields;
import com.skillmap.catalog.store.TopicFilter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Business rules for the topic hierarchy.
 *
 * Each public method is one transaction against the {@link CatalogStore}.
 * No locks are taken: a parent deleted between the existence check and the
 * commit of a create/update can still leave a dangling reference (the
 * database FK catches it for the JPA store).
 */
@Service
public class TopicService {

    private static final Logger log = LoggerFactory.getLogger(TopicService.class);

    private final CatalogStore  store;
    private final PagingPolicy  paging;
    private final MeterRegistry meterRegistry;

    public TopicService(CatalogStore store, PagingPolicy paging, MeterRegistry meterRegistry) {
        this.store         = store;
        this.paging        = paging;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public CatalogPage<Topic> list(ListQuery query) {
        PageWindow window = paging.window(query.limit(), query.offset());
        ResultPage<Topic> page = store.listTopics(
                new TopicFilter(query.search(), query.ownerId()), window);
        return new CatalogPage<>(page.items(), page.total(), window.limit(), window.offset());
    }

    @Transactional(readOnly = true)
    public Topic get(UUID id) {
        return store.findTopic(id).orElseThrow(() -> CatalogException.notFound("Topic"));
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Create a topic, optionally under an existing parent.
     *
     * @throws CatalogException VALIDATION if the name is blank or the parent does not exist
     */
    @Transactional
    public Topic create(String name, String description, UUID parentTopicId) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw CatalogException.missingField("name");
        }
        requireParent(parentTopicId);

        Topic topic = store.createTopic(new TopicFields(trimmed, description, parentTopicId));
        countWrite("create");
        log.info("Created topic {} '{}' (parent={})", topic.getId(), topic.getName(), parentTopicId);
        return topic;
    }

    /**
     * Apply a partial update.
     *
     * The resulting parent reference is checked on every write, including when
     * the caller left it untouched, so a topic whose parent vanished cannot be
     * saved until the reference is fixed or cleared.
     */
    @Transactional
    public Topic update(UUID id, TopicUpdate update) {
        Topic current = get(id);

        String name = current.getName();
        String suppliedName = update.name().orElse(null);
        if (suppliedName != null) {
            name = suppliedName.strip();
            if (name.isEmpty()) {
                throw CatalogException.missingField("name");
            }
        }
        String description = update.description().orElse(current.getDescription());
        UUID   parentId    = update.parentTopicId().orElse(current.getParentTopicId());

        requireParent(parentId);
        rejectCycle(id, parentId);

        Topic topic = store.updateTopic(id, new TopicFields(name, description, parentId));
        countWrite("update");
        log.info("Updated topic {}", id);
        return topic;
    }

    /**
     * Delete a topic that no skill refers to. Child topics become roots.
     *
     * @throws CatalogException NOT_FOUND if absent, CONFLICT if skills still reference it
     */
    @Transactional
    public void delete(UUID id) {
        get(id);
        if (store.topicHasSkills(id)) {
            meterRegistry.counter("catalog.delete.blocked", "entity", "topic").increment();
            throw new CatalogException(Reason.HAS_DEPENDENTS,
                    "Topic has skills; move or delete skills first");
        }
        if (!store.deleteTopic(id)) {
            throw CatalogException.notFound("Topic");
        }
        countWrite("delete");
        log.info("Deleted topic {}", id);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void requireParent(UUID parentId) {
        if (parentId != null && store.findTopic(parentId).isEmpty()) {
            throw CatalogException.danglingReference("parentTopicID");
        }
    }

    /** Walk up from the new parent; reaching {@code topicId} means a cycle. */
    private void rejectCycle(UUID topicId, UUID parentId) {
        Set<UUID> seen = new HashSet<>();
        UUID cursor = parentId;
        while (cursor != null && seen.add(cursor)) {
            if (cursor.equals(topicId)) {
                throw new CatalogException(Reason.INVALID_HIERARCHY,
                        "parentTopicID would make the topic its own ancestor");
            }
            cursor = store.findTopic(cursor).map(Topic::getParentTopicId).orElse(null);
        }
    }

    private void countWrite(String op) {
        meterRegistry.counter("catalog.writes", "entity", "topic", "op", op).increment();
    }
}
