package com.skillmap.catalog.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillmap.catalog.api.dto.CreateTopicRequest;
import com.skillmap.catalog.api.dto.ListResponse;
import com.skillmap.catalog.api.dto.TopicResponse;
import com.skillmap.catalog.model.Topic;
import com.skillmap.catalog.service.ListQuery;
import com.skillmap.catalog.service.TopicService;
import com.skillmap.catalog.service.TopicUpdate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for topics.
 *
 * GET    /topics          : search (q), filter (parentId), paginate (limit, offset)
 * GET    /topics/{id}     : fetch one
 * POST   /topics          : create
 * PUT    /topics/{id}     : partial update
 * DELETE /topics/{id}     : delete, refused with 409 while skills reference it
 *
 * Domain errors are mapped to status codes by {@link CatalogExceptionHandler}.
 */
@RestController
@RequestMapping("/topics")
public class TopicController {

    private final TopicService topicService;

    public TopicController(TopicService topicService) {
        this.topicService = topicService;
    }

    /**
     * Example:
     *   curl 'http://localhost:8080/topics?q=alg&limit=10'
     */
    @GetMapping
    public ListResponse<TopicResponse> list(@RequestParam(required = false) String q,
                                            @RequestParam(required = false) UUID parentId,
                                            @RequestParam(required = false) Integer limit,
                                            @RequestParam(required = false) Integer offset) {
        return ListResponse.from(
                topicService.list(new ListQuery(q, parentId, limit, offset)),
                TopicResponse::from);
    }

    @GetMapping("/{id}")
    public TopicResponse get(@PathVariable UUID id) {
        return TopicResponse.from(topicService.get(id));
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/topics \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"Algebra","parentTopicID":"<uuid>"}'
     */
    @PostMapping
    public ResponseEntity<TopicResponse> create(@RequestBody(required = false) CreateTopicRequest req) {
        CreateTopicRequest body = req != null ? req : new CreateTopicRequest(null, null, null);
        Topic topic = topicService.create(
                body.name(),
                body.description(),
                RequestFields.parseReference(body.parentTopicID(), "parentTopicID"));
        return ResponseEntity.status(HttpStatus.CREATED).body(TopicResponse.from(topic));
    }

    /**
     * Only keys present in the body are applied; send {@code "parentTopicID": null}
     * to turn a topic into a root.
     */
    @PutMapping("/{id}")
    public TopicResponse update(@PathVariable UUID id, @RequestBody(required = false) JsonNode body) {
        TopicUpdate update = new TopicUpdate(
                RequestFields.text(body, "name"),
                RequestFields.text(body, "description"),
                RequestFields.reference(body, "parentTopicID"));
        return TopicResponse.from(topicService.update(id, update));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        topicService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
