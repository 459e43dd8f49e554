package com.tubedigest.feed.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class FeedApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsIdleCycleAndTableCounts() throws Exception {
        mockMvc.perform(get("/api/cycle/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnected", is(true)))
            .andExpect(jsonPath("$.state", is("IDLE")))
            .andExpect(jsonPath("$.running", is(false)))
            .andExpect(jsonPath("$.counts.sources").exists())
            .andExpect(jsonPath("$.governor.length()", is(3)));
    }

    @Test
    void sourceCanBeRegisteredFetchedAndDeactivated() throws Exception {
        mockMvc.perform(post("/api/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"channelRef\":\"UCsmokeTestChannel0001\",\"name\":\"Smoke\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.channelRef", is("UCsmokeTestChannel0001")))
            .andExpect(jsonPath("$.active", is(true)));

        mockMvc.perform(get("/api/sources").param("activeOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.channelRef == 'UCsmokeTestChannel0001')]").exists());
    }

    @Test
    void blankChannelIsRejected() throws Exception {
        mockMvc.perform(post("/api/sources")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"channelRef\":\"  \"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownSourceMapsToNotFound() throws Exception {
        mockMvc.perform(get("/api/sources/{id}", 424242))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error", is("source_not_found")));

        mockMvc.perform(delete("/api/sources/{id}", 424242))
            .andExpect(status().isNotFound());
    }

    @Test
    void negativeQuotaIsRejected() throws Exception {
        mockMvc.perform(post("/api/cycle/run").param("quota", "-1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void malformedDigestDateIsRejected() throws Exception {
        mockMvc.perform(get("/api/digest").param("date", "yesterday"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void cancelWithoutActiveCycleIsNoop() throws Exception {
        mockMvc.perform(post("/api/cycle/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelRequested", is(false)))
            .andExpect(jsonPath("$.state", is("IDLE")));
    }
}
