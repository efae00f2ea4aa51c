package com.example.messenger.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.messenger.support.MessengerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

public class QueueAdminControllerTest {

    private MessengerFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        fixture = new MessengerFixture().withThreeOnlineAgents();
        mockMvc = MockMvcBuilders.standaloneSetup(new QueueAdminController(fixture.queue))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    public void emptyQueueHasNoMembers() throws Exception {
        mockMvc.perform(get("/api/inboxes/1/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inbox_id").value(1))
                .andExpect(jsonPath("$.member_ids").isEmpty());
    }

    @Test
    public void resetAddAndRemoveMembers() throws Exception {
        mockMvc.perform(put("/api/inboxes/1/queue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"member_ids\":[3,1]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.member_ids[0]").value(3))
                .andExpect(jsonPath("$.member_ids[1]").value(1));

        mockMvc.perform(post("/api/inboxes/1/queue/agents/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.member_ids[2]").value(2));

        mockMvc.perform(delete("/api/inboxes/1/queue/agents/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.member_ids.length()").value(2))
                .andExpect(jsonPath("$.member_ids[0]").value(1));
    }

    @Test
    public void storeOutageIsUnavailable() throws Exception {
        fixture.store.setUnavailable(true);

        mockMvc.perform(get("/api/inboxes/1/queue"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("store_unavailable"));
    }
}
