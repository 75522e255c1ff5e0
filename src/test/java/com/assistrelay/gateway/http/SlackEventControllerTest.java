package com.assistrelay.gateway.http;

import com.assistrelay.intake.EventIntakeCoordinator;
import com.assistrelay.observability.DoctorCommand;
import com.assistrelay.shared.model.WebhookReply;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SlackEventControllerTest {

    private EventIntakeCoordinator coordinator;
    private DoctorCommand doctor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(EventIntakeCoordinator.class);
        doctor = mock(DoctorCommand.class);
        mvc = MockMvcBuilders.standaloneSetup(new SlackEventController(coordinator, doctor)).build();
    }

    @Test
    void handshakeReturnsOnlyChallenge() throws Exception {
        when(coordinator.handle(any(JsonNode.class), isNull())).thenReturn(WebhookReply.challenge("abc123"));

        mvc.perform(post("/slack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"url_verification\",\"challenge\":\"abc123\"}"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"challenge\":\"abc123\"}", true));
    }

    @Test
    void passesRetryHeaderThrough() throws Exception {
        when(coordinator.handle(any(JsonNode.class), eq("2"))).thenReturn(WebhookReply.ok());

        mvc.perform(post("/slack")
                        .header("X-Slack-Retry-Num", "2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"Ev1\",\"event\":{\"text\":\"hi\"}}"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"status\":\"ok\"}", true));
    }

    @Test
    void errorReplyCarriesMessage() throws Exception {
        when(coordinator.handle(any(JsonNode.class), isNull()))
                .thenReturn(WebhookReply.error("Run failed with status: failed"));

        mvc.perform(post("/slack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_id\":\"Ev1\",\"event\":{\"text\":\"hi\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Run failed with status: failed"));
    }

    @Test
    void doctorReturnsPlainText() throws Exception {
        when(doctor.run()).thenReturn("[OK] Java 17");

        mvc.perform(get("/doctor"))
                .andExpect(status().isOk())
                .andExpect(content().string("[OK] Java 17"));
    }
}
