package com.project.lingodeck.backend;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Review flow over HTTP")
class ReviewFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private String createCard(String ownerId, String body) throws Exception {
        String response = mockMvc.perform(post("/api/cards/{ownerId}", ownerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(response, "$.mainBody.id");
    }

    @Test
    @DisplayName("cards created for a learner are reviewed one by one until the summary")
    void reviewNewCards() throws Exception {
        String owner = "learner-" + UUID.randomUUID();
        String first = createCard(owner, """
                {"cardType": "VOCABULARY", "front": "Baum", "back": "tree"}
                """);
        String second = createCard(owner, """
                {"cardType": "SENTENCE_PRODUCTION", "prompt": "I am tired", "answer": "Ich bin müde"}
                """);

        String started = mockMvc.perform(post("/api/review/{ownerId}/start", owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Review started"))
                .andExpect(jsonPath("$.mainBody.remaining").value(1))
                .andReturn().getResponse().getContentAsString();
        String active = JsonPath.read(started, "$.mainBody.card.id");
        String next = active.equals(first) ? second : first;

        mockMvc.perform(post("/api/review/{ownerId}/outcome", owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardId\": \"" + next + "\", \"grade\": 2}"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/review/{ownerId}/outcome", owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardId\": \"" + active + "\", \"grade\": 2, \"submissionToken\": \"m1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.card.id").value(next));

        mockMvc.perform(post("/api/review/{ownerId}/outcome", owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardId\": \"" + active + "\", \"grade\": 2, \"submissionToken\": \"m1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.card.id").value(next));

        mockMvc.perform(post("/api/review/{ownerId}/outcome", owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardId\": \"" + next + "\", \"grade\": 0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Review session finished"))
                .andExpect(jsonPath("$.mainBody.summary.reviewed").value(2))
                .andExpect(jsonPath("$.mainBody.summary.recallRate").value(50.0));

        mockMvc.perform(get("/api/review/{ownerId}", owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.mode").value("IDLE"));

        mockMvc.perform(get("/api/cards/{ownerId}/{cardId}", owner, active))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.repetitions").value(1))
                .andExpect(jsonPath("$.mainBody.intervalDays").value(1));

        mockMvc.perform(get("/api/cards/{ownerId}/stats", owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.total").value(2))
                .andExpect(jsonPath("$.mainBody.newCards").value(0));
    }

    @Test
    @DisplayName("editing suspends the review and a foreign card cannot be edited")
    void editDuringReview() throws Exception {
        String owner = "learner-" + UUID.randomUUID();
        String card = createCard(owner, """
                {"cardType": "GRAMMAR_FORM", "dictionaryForm": "sein", "prompt": "3rd person singular", "answer": "ist"}
                """);
        String foreign = createCard("learner-" + UUID.randomUUID(), """
                {"cardType": "VOCABULARY", "front": "Haus", "back": "house"}
                """);

        mockMvc.perform(post("/api/review/{ownerId}/start", owner)).andExpect(status().isOk());

        mockMvc.perform(post("/api/review/{ownerId}/edit/{cardId}", owner, foreign))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/review/{ownerId}/edit/{cardId}", owner, card))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.mode").value("EDITING"))
                .andExpect(jsonPath("$.mainBody.activeCardId").value(card));

        mockMvc.perform(post("/api/review/{ownerId}/outcome", owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardId\": \"" + card + "\", \"grade\": 3}"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/review/{ownerId}/edit/finish", owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.mode").value("REVIEWING"));

        mockMvc.perform(post("/api/review/{ownerId}/cancel", owner)).andExpect(status().isOk());
        mockMvc.perform(get("/api/review/{ownerId}", owner))
                .andExpect(jsonPath("$.mainBody.mode").value("IDLE"))
                .andExpect(jsonPath("$.mainBody.activeCardId").doesNotExist());
    }

    @Test
    @DisplayName("a card with a missing required field is rejected")
    void invalidCard() throws Exception {
        mockMvc.perform(post("/api/cards/{ownerId}", "learner-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"cardType": "VOCABULARY", "front": "Baum"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request: back: back is required"));
    }
}
