package com.skillmap.catalog.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillmap.catalog.api.dto.CreateSkillRequest;
import com.skillmap.catalog.api.dto.ListResponse;
import com.skillmap.catalog.api.dto.SkillResponse;
import com.skillmap.catalog.model.Skill;
import com.skillmap.catalog.service.ListQuery;
import com.skillmap.catalog.service.SkillService;
import com.skillmap.catalog.service.SkillUpdate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for skills.
 *
 * GET    /skills          : search (q), filter (topicId), paginate (limit, offset)
 * GET    /skills/{id}     : fetch one
 * POST   /skills          : create under an existing topic
 * PUT    /skills/{id}     : partial update
 * DELETE /skills/{id}     : delete
 */
@RestController
@RequestMapping("/skills")
public class SkillController {

    private final SkillService skillService;

    public SkillController(SkillService skillService) {
        this.skillService = skillService;
    }

    @GetMapping
    public ListResponse<SkillResponse> list(@RequestParam(required = false) String q,
                                            @RequestParam(required = false) UUID topicId,
                                            @RequestParam(required = false) Integer limit,
                                            @RequestParam(required = false) Integer offset) {
        return ListResponse.from(
                skillService.list(new ListQuery(q, topicId, limit, offset)),
                SkillResponse::from);
    }

    @GetMapping("/{id}")
    public SkillResponse get(@PathVariable UUID id) {
        return SkillResponse.from(skillService.get(id));
    }

    @PostMapping
    public ResponseEntity<SkillResponse> create(@RequestBody(required = false) CreateSkillRequest req) {
        CreateSkillRequest body = req != null ? req : new CreateSkillRequest(null, null, null, null);
        Skill skill = skillService.create(
                body.name(),
                RequestFields.parseReference(body.resolvedTopicId(), "topicID"),
                body.difficulty());
        return ResponseEntity.status(HttpStatus.CREATED).body(SkillResponse.from(skill));
    }

    @PutMapping("/{id}")
    public SkillResponse update(@PathVariable UUID id, @RequestBody(required = false) JsonNode body) {
        SkillUpdate update = new SkillUpdate(
                RequestFields.text(body, "name"),
                RequestFields.reference(body, "topicID", "topicId"),
                RequestFields.text(body, "difficulty"));
        return SkillResponse.from(skillService.update(id, update));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        skillService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
