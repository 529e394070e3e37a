package com.skillmap.catalog.service;

import com.skillmap.catalog.model.Skill;
import com.skillmap.catalog.model.Topic;
import com.skillmap.catalog.service.CatalogException.Kind;
import com.skillmap.catalog.service.CatalogException.Reason;
import com.skillmap.catalog.store.CatalogStore;
import com.skillmap.catalog.store.PageWindow;
import com.skillmap.catalog.store.ResultPage;
import com.skillmap.catalog.store.SkillFields;
import com.skillmap.catalog.store.SkillFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SkillService with a mocked store.
 */
@ExtendWith(MockitoExtension.class)
class SkillServiceTest {

    @Mock CatalogStore store;

    SkillService service;
    Topic math;

    @BeforeEach
    void setUp() {
        service = new SkillService(store, new PagingPolicy(50, 200), new SimpleMeterRegistry());
        math = new Topic(UUID.randomUUID(), "Math", null, null, Instant.now(), Instant.now());
    }

    @Test
    void list_filtersByTopicWithDefaultWindow() {
        when(store.listSkills(any(), any())).thenReturn(new ResultPage<>(List.of(), 0));

        CatalogPage<Skill> page = service.list(new ListQuery(null, math.getId(), null, 10));

        verify(store).listSkills(new SkillFilter(null, math.getId()), new PageWindow(50, 10));
        assertThat(page.offset()).isEqualTo(10);
    }

    @Test
    void get_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(store.findSkill(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get(id))
                .isInstanceOf(CatalogException.class)
                .hasMessage("Skill not found");
    }

    // ------------------------------------------------------------------
    // create()
    // ------------------------------------------------------------------

    @Test
    void create_blankName_throwsValidation() {
        assertThatThrownBy(() -> service.create(" ", math.getId(), null))
                .isInstanceOf(CatalogException.class)
                .hasMessage("Field 'name' is required");
        verifyNoInteractions(store);
    }

    @Test
    void create_missingTopic_throwsValidation() {
        assertThatThrownBy(() -> service.create("Addition", null, null))
                .isInstanceOf(CatalogException.class)
                .hasMessage("Field 'topicID' is required")
                .extracting("reason").isEqualTo(Reason.MISSING_FIELD);
    }

    @Test
    void create_unknownTopic_throwsValidation() {
        UUID unknown = UUID.randomUUID();
        when(store.findTopic(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.create("Addition", unknown, null))
                .isInstanceOf(CatalogException.class)
                .hasMessage("topicID not found")
                .extracting("kind").isEqualTo(Kind.VALIDATION);
        verify(store, never()).createSkill(any());
    }

    @Test
    void create_withoutDifficulty_defaultsToBeginner() {
        when(store.findTopic(math.getId())).thenReturn(Optional.of(math));
        when(store.createSkill(any())).thenReturn(skill("Addition", "beginner"));

        service.create("Addition", math.getId(), "  ");

        verify(store).createSkill(new SkillFields("Addition", math.getId(), "beginner"));
    }

    @Test
    void create_trimsNameAndDifficulty() {
        when(store.findTopic(math.getId())).thenReturn(Optional.of(math));
        when(store.createSkill(any())).thenReturn(skill("Calculus", "advanced"));

        service.create(" Calculus ", math.getId(), " advanced ");

        verify(store).createSkill(new SkillFields("Calculus", math.getId(), "advanced"));
    }

    // ------------------------------------------------------------------
    // update()
    // ------------------------------------------------------------------

    @Test
    void update_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(store.findSkill(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.update(id, new SkillUpdate(null, null, null)))
                .isInstanceOf(CatalogException.class)
                .extracting("kind").isEqualTo(Kind.NOT_FOUND);
    }

    @Test
    void update_onlyDifficulty_keepsNameAndRevalidatesTopic() {
        Skill current = skill("Addition", "beginner");
        when(store.findSkill(current.getId())).thenReturn(Optional.of(current));
        when(store.findTopic(math.getId())).thenReturn(Optional.of(math));
        when(store.updateSkill(eq(current.getId()), any())).thenReturn(current);

        service.update(current.getId(), new SkillUpdate(null, null, FieldUpdate.set("intermediate")));

        verify(store).findTopic(math.getId());
        verify(store).updateSkill(current.getId(), new SkillFields("Addition", math.getId(), "intermediate"));
    }

    @Test
    void update_blankDifficulty_keepsCurrent() {
        Skill current = skill("Addition", "advanced");
        when(store.findSkill(current.getId())).thenReturn(Optional.of(current));
        when(store.findTopic(math.getId())).thenReturn(Optional.of(math));
        when(store.updateSkill(eq(current.getId()), any())).thenReturn(current);

        service.update(current.getId(), new SkillUpdate(null, null, FieldUpdate.set("")));

        verify(store).updateSkill(current.getId(), new SkillFields("Addition", math.getId(), "advanced"));
    }

    @Test
    void update_moveToUnknownTopic_throwsValidation() {
        Skill current = skill("Addition", "beginner");
        UUID unknown = UUID.randomUUID();
        when(store.findSkill(current.getId())).thenReturn(Optional.of(current));
        when(store.findTopic(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.update(current.getId(),
                new SkillUpdate(null, FieldUpdate.set(unknown), null)))
                .isInstanceOf(CatalogException.class)
                .hasMessage("topicID not found");
        verify(store, never()).updateSkill(any(), any());
    }

    @Test
    void update_explicitNullTopic_throwsMissingField() {
        Skill current = skill("Addition", "beginner");
        when(store.findSkill(current.getId())).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> service.update(current.getId(),
                new SkillUpdate(null, FieldUpdate.set(null), null)))
                .isInstanceOf(CatalogException.class)
                .hasMessage("Field 'topicID' is required");
    }

    @Test
    void update_blankName_throwsValidation() {
        Skill current = skill("Addition", "beginner");
        when(store.findSkill(current.getId())).thenReturn(Optional.of(current));

        assertThatThrownBy(() -> service.update(current.getId(),
                new SkillUpdate(FieldUpdate.set(" "), null, null)))
                .isInstanceOf(CatalogException.class)
                .extracting("reason").isEqualTo(Reason.MISSING_FIELD);
    }

    // ------------------------------------------------------------------
    // delete()
    // ------------------------------------------------------------------

    @Test
    void delete_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(store.deleteSkill(id)).thenReturn(false);

        assertThatThrownBy(() -> service.delete(id))
                .isInstanceOf(CatalogException.class)
                .extracting("kind").isEqualTo(Kind.NOT_FOUND);
    }

    @Test
    void delete_existingSkill_isUnconditional() {
        UUID id = UUID.randomUUID();
        when(store.deleteSkill(id)).thenReturn(true);

        service.delete(id);

        verify(store).deleteSkill(id);
        verify(store, never()).topicHasSkills(any());
    }

    private Skill skill(String name, String difficulty) {
        Instant now = Instant.now();
        return new Skill(UUID.randomUUID(), name, math.getId(), difficulty, now, now);
    }
}
