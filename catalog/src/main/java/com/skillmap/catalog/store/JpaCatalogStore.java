package com.skillmap.catalog.store;

import com.skillmap.catalog.model.Skill;
import com.skillmap.catalog.model.Topic;
import com.skillmap.catalog.repository.SkillRepository;
import com.skillmap.catalog.repository.TopicRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link CatalogStore} backed by PostgreSQL through Spring Data JPA.
 *
 * Runs inside the caller's transaction: the services open one per operation,
 * so an existence check and the write that follows share a connection.
 */
@Component
@ConditionalOnProperty(name = "catalog.store", havingValue = "jpa", matchIfMissing = true)
public class JpaCatalogStore implements CatalogStore {

    // Deterministic order: ties on name are broken by id.
    static final Sort BY_NAME = Sort.by(Sort.Order.asc("name"), Sort.Order.asc("id"));

    private final TopicRepository topicRepo;
    private final SkillRepository skillRepo;

    public JpaCatalogStore(TopicRepository topicRepo, SkillRepository skillRepo) {
        this.topicRepo = topicRepo;
        this.skillRepo = skillRepo;
    }

    // ------------------------------------------------------------------
    // Topics
    // ------------------------------------------------------------------

    @Override
    public Optional<Topic> findTopic(UUID id) {
        return topicRepo.findById(id);
    }

    @Override
    public ResultPage<Topic> listTopics(TopicFilter filter, PageWindow window) {
        Specification<Topic> spec = Specification
                .where(NameSpecs.<Topic>nameContains(filter.namePattern()))
                .and(NameSpecs.equalTo("parentTopicId", filter.parentId()));

        if (window.isEmpty()) {
            return new ResultPage<>(List.of(), topicRepo.count(spec));
        }
        Page<Topic> page = topicRepo.findAll(spec, new OffsetWindowRequest(window, BY_NAME));
        return new ResultPage<>(page.getContent(), page.getTotalElements());
    }

    @Override
    public Topic createTopic(TopicFields fields) {
        return topicRepo.save(new Topic(fields.name(), fields.description(), fields.parentTopicId()));
    }

    @Override
    public Topic updateTopic(UUID id, TopicFields fields) {
        Topic topic = topicRepo.findById(id).orElseThrow();
        topic.setName(fields.name());
        topic.setDescription(fields.description());
        topic.setParentTopicId(fields.parentTopicId());
        return topicRepo.saveAndFlush(topic);
    }

    @Override
    public boolean deleteTopic(UUID id) {
        if (!topicRepo.existsById(id)) {
            return false;
        }
        topicRepo.detachChildren(id);
        topicRepo.deleteById(id);
        return true;
    }

    @Override
    public boolean topicHasSkills(UUID topicId) {
        return skillRepo.existsByTopicId(topicId);
    }

    // ------------------------------------------------------------------
    // Skills
    // ------------------------------------------------------------------

    @Override
    public Optional<Skill> findSkill(UUID id) {
        return skillRepo.findById(id);
    }

    @Override
    public ResultPage<Skill> listSkills(SkillFilter filter, PageWindow window) {
        Specification<Skill> spec = Specification
                .where(NameSpecs.<Skill>nameContains(filter.namePattern()))
                .and(NameSpecs.equalTo("topicId", filter.topicId()));

        if (window.isEmpty()) {
            return new ResultPage<>(List.of(), skillRepo.count(spec));
        }
        Page<Skill> page = skillRepo.findAll(spec, new OffsetWindowRequest(window, BY_NAME));
        return new ResultPage<>(page.getContent(), page.getTotalElements());
    }

    @Override
    public Skill createSkill(SkillFields fields) {
        return skillRepo.save(new Skill(fields.name(), fields.topicId(), fields.difficulty()));
    }

    @Override
    public Skill updateSkill(UUID id, SkillFields fields) {
        Skill skill = skillRepo.findById(id).orElseThrow();
        skill.setName(fields.name());
        skill.setTopicId(fields.topicId());
        skill.setDifficulty(fields.difficulty());
        return skillRepo.saveAndFlush(skill);
    }

    @Override
    public boolean deleteSkill(UUID id) {
        if (!skillRepo.existsById(id)) {
            return false;
        }
        skillRepo.deleteById(id);
        return true;
    }

    // ------------------------------------------------------------------
    // Specifications
    // ------------------------------------------------------------------

    /** Null-tolerant predicates: an absent filter value yields no restriction. */
    static final class NameSpecs {

        private NameSpecs() {}

        static <T> Specification<T> nameContains(String pattern) {
            if (!NamePatterns.isActive(pattern)) return null;
            String like = NamePatterns.likeContains(pattern);
            return (root, query, cb) ->
                    cb.like(cb.lower(root.<String>get("name")), like, NamePatterns.ESCAPE);
        }

        static <T> Specification<T> equalTo(String attribute, UUID value) {
            if (value == null) return null;
            return (root, query, cb) -> cb.equal(root.get(attribute), value);
        }
    }
}
