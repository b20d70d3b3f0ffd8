package com.adlanda.knowledgesync.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApiController.class)
class ApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void rootEndpoint_returnsServiceInfo() throws Exception {
        mockMvc.perform(get("/api/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Knowledge Sync"))
                .andExpect(jsonPath("$.version").exists());
    }

    @Test
    void rootEndpoint_listsQueueEndpoints() throws Exception {
        mockMvc.perform(get("/api/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints.queueStats").exists())
                .andExpect(jsonPath("$.endpoints.retroactive").exists())
                .andExpect(jsonPath("$.endpoints.resetFailed").exists())
                .andExpect(jsonPath("$.endpoints.resetStale").exists())
                .andExpect(jsonPath("$.endpoints.health").exists());
    }
}
