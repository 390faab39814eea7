package com.jobcache.janitor.cleanup.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CleanupApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private CleanupCorsFilter corsFilter;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).addFilters(corsFilter).build();
    }

    @Test
    void preflightReturnsEmptyBodyWithCorsHeaders() throws Exception {
        mockMvc.perform(options("/api/cleanup-jobs")
                .header("Origin", "https://app.example.com")
                .header("Access-Control-Request-Method", "POST"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "*"))
            .andExpect(header().string(
                "Access-Control-Allow-Headers",
                "authorization, x-client-info, apikey, content-type"
            ))
            .andExpect(content().string(""));
    }

    @Test
    void cleanupReturnsSummaryShape() throws Exception {
        mockMvc.perform(post("/api/cleanup-jobs"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(header().string("Access-Control-Allow-Origin", "*"))
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.deletedExpiredJobs").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.resetStaleSearchTerms").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.deletedOrphanedTerms").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.oldCacheDeleted").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.currentStats.totalJobs").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.currentStats.totalSearchTerms").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.currentStats.totalLinks").value(greaterThanOrEqualTo(0)));
    }

    @Test
    void cleanupAlsoAcceptsGet() throws Exception {
        mockMvc.perform(get("/api/cleanup-jobs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
    }
}
