package com.skillmap.catalog.service;

import com.skillmap.catalog.model.Skill;
import com.skillmap.catalog.store.CatalogStore;
import com.skillmap.catalog.store.PageWindow;
import com.skillmap.catalog.store.ResultPage;
import com.skillmap.catalog.store.SkillFields;
import com.skillmap.catalog.store.SkillFilter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Business rules for skills: every skill must point at an existing topic.
 */
@Service
public class SkillService {

    private static final Logger log = LoggerFactory.getLogger(SkillService.class);

    private final CatalogStore  store;
    private final PagingPolicy  paging;
    private final MeterRegistry meterRegistry;

    public SkillService(CatalogStore store, PagingPolicy paging, MeterRegistry meterRegistry) {
        this.store         = store;
        this.paging        = paging;
        this.meterRegistry = meterRegistry;
    }

    @Transactional(readOnly = true)
    public CatalogPage<Skill> list(ListQuery query) {
        PageWindow window = paging.window(query.limit(), query.offset());
        ResultPage<Skill> page = store.listSkills(
                new SkillFilter(query.search(), query.ownerId()), window);
        return new CatalogPage<>(page.items(), page.total(), window.limit(), window.offset());
    }

    @Transactional(readOnly = true)
    public Skill get(UUID id) {
        return store.findSkill(id).orElseThrow(() -> CatalogException.notFound("Skill"));
    }

    /**
     * Create a skill under an existing topic. A blank difficulty becomes
     * {@value Skill#DEFAULT_DIFFICULTY}.
     */
    @Transactional
    public Skill create(String name, UUID topicId, String difficulty) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw CatalogException.missingField("name");
        }
        requireTopic(topicId);

        Skill skill = store.createSkill(new SkillFields(trimmed, topicId,
                normalizeDifficulty(difficulty, Skill.DEFAULT_DIFFICULTY)));
        countWrite("create");
        log.info("Created skill {} '{}' under topic {}", skill.getId(), skill.getName(), topicId);
        return skill;
    }

    /**
     * Apply a partial update. The resulting topic reference is re-checked on
     * every write, changed or not.
     */
    @Transactional
    public Skill update(UUID id, SkillUpdate update) {
        Skill current = get(id);

        String name = current.getName();
        String suppliedName = update.name().orElse(null);
        if (suppliedName != null) {
            name = suppliedName.strip();
            if (name.isEmpty()) {
                throw CatalogException.missingField("name");
            }
        }
        UUID   topicId    = update.topicId().orElse(current.getTopicId());
        String difficulty = normalizeDifficulty(update.difficulty().orElse(null), current.getDifficulty());

        requireTopic(topicId);

        Skill skill = store.updateSkill(id, new SkillFields(name, topicId, difficulty));
        countWrite("update");
        log.info("Updated skill {}", id);
        return skill;
    }

    @Transactional
    public void delete(UUID id) {
        if (!store.deleteSkill(id)) {
            throw CatalogException.notFound("Skill");
        }
        countWrite("delete");
        log.info("Deleted skill {}", id);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void requireTopic(UUID topicId) {
        if (topicId == null) {
            throw CatalogException.missingField("topicID");
        }
        if (store.findTopic(topicId).isEmpty()) {
            throw CatalogException.danglingReference("topicID");
        }
    }

    private static String normalizeDifficulty(String supplied, String fallback) {
        if (supplied == null || supplied.isBlank()) return fallback;
        return supplied.strip();
    }

    private void countWrite(String op) {
        meterRegistry.counter("catalog.writes", "entity", "skill", "op", op).increment();
    }
}
