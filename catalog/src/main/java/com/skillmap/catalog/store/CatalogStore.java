package com.skillmap.catalog.store;

import com.skillmap.catalog.model.Skill;
import com.skillmap.catalog.model.Topic;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for topics and skills.
 *
 * Implementations hold no business rules: existence checks, the delete guard
 * and paging defaults live in the service layer. Every listing is ordered by
 * name ascending, then id ascending, and reports the total number of matches
 * independently of the requested window.
 */
public interface CatalogStore {

    // ------------------------------------------------------------------
    // Topics
    // ------------------------------------------------------------------

    Optional<Topic> findTopic(UUID id);

    ResultPage<Topic> listTopics(TopicFilter filter, PageWindow window);

    Topic createTopic(TopicFields fields);

    /** Overwrites every field of an existing topic. The caller checks existence first. */
    Topic updateTopic(UUID id, TopicFields fields);

    /**
     * Removes a topic. Child topics are detached (their parent reference is
     * cleared), never deleted.
     *
     * @return false if no topic had this id
     */
    boolean deleteTopic(UUID id);

    boolean topicHasSkills(UUID topicId);

    // ------------------------------------------------------------------
    // Skills
    // ------------------------------------------------------------------

    Optional<Skill> findSkill(UUID id);

    ResultPage<Skill> listSkills(SkillFilter filter, PageWindow window);

    Skill createSkill(SkillFields fields);

    Skill updateSkill(UUID id, SkillFields fields);

    boolean deleteSkill(UUID id);
}
