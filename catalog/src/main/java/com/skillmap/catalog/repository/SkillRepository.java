package com.skillmap.catalog.repository;

import com.skillmap.catalog.model.Skill;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.UUID;

/**
 * CRUD + filtered listing for the skills table.
 */
public interface SkillRepository extends JpaRepository<Skill, UUID>, JpaSpecificationExecutor<Skill> {

    /** Backs the topic delete guard. */
    boolean existsByTopicId(UUID topicId);
}
