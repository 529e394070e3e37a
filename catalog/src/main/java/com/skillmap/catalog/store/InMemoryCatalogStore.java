package com.skillmap.catalog.store;

import com.skillmap.catalog.model.Skill;
import com.skillmap.catalog.model.Topic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * {@link CatalogStore} kept in process memory.
 *
 * Selected with {@code catalog.store=memory} (see the {@code memory} profile).
 * Callers always receive copies, so mutating a returned entity never changes
 * stored state. Individual operations are atomic; there are no multi-call
 * transactions.
 */
@Component
@ConditionalOnProperty(name = "catalog.store", havingValue = "memory")
public class InMemoryCatalogStore implements CatalogStore {

    // Ids compare by their canonical text, which is PostgreSQL's (unsigned) uuid order.
    private static final Comparator<Topic> TOPIC_ORDER =
            Comparator.comparing(Topic::getName).thenComparing(t -> t.getId().toString());
    private static final Comparator<Skill> SKILL_ORDER =
            Comparator.comparing(Skill::getName).thenComparing(s -> s.getId().toString());

    private final Map<UUID, Topic> topics = new ConcurrentHashMap<>();
    private final Map<UUID, Skill> skills = new ConcurrentHashMap<>();

    // ------------------------------------------------------------------
    // Topics
    // ------------------------------------------------------------------

    @Override
    public Optional<Topic> findTopic(UUID id) {
        return Optional.ofNullable(topics.get(id)).map(InMemoryCatalogStore::copy);
    }

    @Override
    public ResultPage<Topic> listTopics(TopicFilter filter, PageWindow window) {
        Predicate<Topic> match = t -> NamePatterns.matches(t.getName(), filter.namePattern())
                && (filter.parentId() == null || filter.parentId().equals(t.getParentTopicId()));
        return slice(topics.values().stream().filter(match).sorted(TOPIC_ORDER).toList(),
                window, InMemoryCatalogStore::copy);
    }

    @Override
    public Topic createTopic(TopicFields fields) {
        Instant now = Instant.now();
        Topic topic = new Topic(UUID.randomUUID(), fields.name(), fields.description(),
                fields.parentTopicId(), now, now);
        topics.put(topic.getId(), topic);
        return copy(topic);
    }

    @Override
    public Topic updateTopic(UUID id, TopicFields fields) {
        Topic updated = topics.computeIfPresent(id, (key, current) -> new Topic(key,
                fields.name(), fields.description(), fields.parentTopicId(),
                current.getCreatedAt(), Instant.now()));
        if (updated == null) {
            throw new IllegalStateException("No topic with id " + id);
        }
        return copy(updated);
    }

    @Override
    public synchronized boolean deleteTopic(UUID id) {
        if (topics.remove(id) == null) {
            return false;
        }
        topics.replaceAll((key, t) -> id.equals(t.getParentTopicId())
                ? new Topic(key, t.getName(), t.getDescription(), null, t.getCreatedAt(), Instant.now())
                : t);
        return true;
    }

    @Override
    public boolean topicHasSkills(UUID topicId) {
        return skills.values().stream().anyMatch(s -> topicId.equals(s.getTopicId()));
    }

    // ------------------------------------------------------------------
    // Skills
    // ------------------------------------------------------------------

    @Override
    public Optional<Skill> findSkill(UUID id) {
        return Optional.ofNullable(skills.get(id)).map(InMemoryCatalogStore::copy);
    }

    @Override
    public ResultPage<Skill> listSkills(SkillFilter filter, PageWindow window) {
        Predicate<Skill> match = s -> NamePatterns.matches(s.getName(), filter.namePattern())
                && (filter.topicId() == null || filter.topicId().equals(s.getTopicId()));
        return slice(skills.values().stream().filter(match).sorted(SKILL_ORDER).toList(),
                window, InMemoryCatalogStore::copy);
    }

    @Override
    public Skill createSkill(SkillFields fields) {
        Instant now = Instant.now();
        Skill skill = new Skill(UUID.randomUUID(), fields.name(), fields.topicId(),
                fields.difficulty(), now, now);
        skills.put(skill.getId(), skill);
        return copy(skill);
    }

    @Override
    public Skill updateSkill(UUID id, SkillFields fields) {
        Skill updated = skills.computeIfPresent(id, (key, current) -> new Skill(key,
                fields.name(), fields.topicId(), fields.difficulty(),
                current.getCreatedAt(), Instant.now()));
        if (updated == null) {
            throw new IllegalStateException("No skill with id " + id);
        }
        return copy(updated);
    }

    @Override
    public boolean deleteSkill(UUID id) {
        return skills.remove(id) != null;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static <T> ResultPage<T> slice(List<T> matches, PageWindow window, Function<T, T> copier) {
        if (window.isEmpty() || window.offset() >= matches.size()) {
            return new ResultPage<>(List.of(), matches.size());
        }
        int from = Math.max(window.offset(), 0);
        int to   = (int) Math.min((long) from + window.limit(), matches.size());
        return new ResultPage<>(matches.subList(from, to).stream().map(copier).toList(), matches.size());
    }

    private static Topic copy(Topic t) {
        return new Topic(t.getId(), t.getName(), t.getDescription(), t.getParentTopicId(),
                t.getCreatedAt(), t.getUpdatedAt());
    }

    private static Skill copy(Skill s) {
        return new Skill(s.getId(), s.getName(), s.getTopicId(), s.getDifficulty(),
                s.getCreatedAt(), s.getUpdatedAt());
    }
}
