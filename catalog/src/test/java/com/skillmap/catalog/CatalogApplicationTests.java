package com.skillmap.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application context on the in-memory store, driven over HTTP.
 * No database is needed: the memory profile switches off the JPA stack.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class CatalogApplicationTests {

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @Test
    void healthz_returnsOk() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void topicAndSkillLifecycle() throws Exception {
        String mathId = createTopic("{\"name\":\"Scenario Math\"}");
        createTopic("{\"name\":\"Scenario Algebra\",\"parentTopicID\":\"" + mathId + "\"}");

        MvcResult skillResult = mockMvc.perform(post("/skills")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Addition\",\"topicID\":\"" + mathId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.difficulty").value("beginner"))
                .andReturn();
        String skillId = idOf(skillResult);

        mockMvc.perform(delete("/topics/{id}", mathId))
                .andExpect(status().isConflict());

        mockMvc.perform(delete("/skills/{id}", skillId))
                .andExpect(status().isNoContent());

        mockMvc.perform(delete("/topics/{id}", mathId))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/topics/{id}", mathId))
                .andExpect(status().isNotFound());
    }

    @Test
    void search_isCaseInsensitiveAndClampsPaging() throws Exception {
        createTopic("{\"name\":\"Search ALGEBRA\"}");
        createTopic("{\"name\":\"Search algorithms\"}");
        createTopic("{\"name\":\"Search geometry\"}");

        mockMvc.perform(get("/topics").param("q", "search alg").param("limit", "1000").param("offset", "-5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.total").value(2))
                .andExpect(jsonPath("$.meta.limit").value(200))
                .andExpect(jsonPath("$.meta.offset").value(0))
                .andExpect(jsonPath("$.data[0].name").value("Search ALGEBRA"))
                .andExpect(jsonPath("$.data[1].name").value("Search algorithms"));
    }

    @Test
    void createSkill_unknownTopic_returns422() throws Exception {
        mockMvc.perform(post("/skills")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Orphan\",\"topicID\":\"00000000-0000-0000-0000-000000000000\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("topicID not found"));
    }

    private String createTopic(String json) throws Exception {
        MvcResult result = mockMvc.perform(post("/topics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andReturn();
        return idOf(result);
    }

    private String idOf(MvcResult result) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("id").asText();
    }
}
