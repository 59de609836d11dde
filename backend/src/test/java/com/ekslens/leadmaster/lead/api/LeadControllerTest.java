package com.ekslens.leadmaster.lead.api;

import com.ekslens.leadmaster.lead.job.JobState;
import com.ekslens.leadmaster.lead.service.LeadAggregationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.UUID;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class LeadControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private JobState jobState;

    @Autowired
    private LeadAggregationService aggregationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        awaitIdle();
        aggregationService.changeIndustry("medical_aesthetics");
    }

    @Test
    void statusReportsDatabaseAndCounts() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.databaseConnected").value(true))
            .andExpect(jsonPath("$.industry").value("Medical Aesthetics"))
            .andExpect(jsonPath("$.counts.total_leads").value(greaterThanOrEqualTo(0)));
    }

    @Test
    void searchRunsToCompletionWithoutConfiguredSources() throws Exception {
        mockMvc.perform(post("/api/search/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cities\":[\"madrid\"],\"keywords\":[\"botox\"],\"maxSearches\":1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accepted").value(true));

        awaitIdle();

        mockMvc.perform(get("/api/results"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.industryId").value("medical_aesthetics"))
            .andExpect(jsonPath("$.phases[*].status").value(hasItem("SKIPPED")));

        mockMvc.perform(get("/api/logs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.logs[*].message").value(hasItem("SerpApi not configured, skipping")));
    }

    @Test
    void startWhileRunningIsConflict() throws Exception {
        awaitIdle();
        jobState.tryStart("held by test");
        try {
            mockMvc.perform(post("/api/search/start").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.reason").value("job_already_running"));
        } finally {
            jobState.fail("released by test");
        }
    }

    @Test
    void oversizedSearchIsRejected() throws Exception {
        mockMvc.perform(post("/api/search/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"maxSearches\":500}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"));

        mockMvc.perform(post("/api/search/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sources\":{\"yellowpages\":true}}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void stopWhenIdleReportsNothingToStop() throws Exception {
        mockMvc.perform(post("/api/search/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stopping").value(false));
    }

    @Test
    void manualLeadIsDeduplicated() throws Exception {
        String name = "Clínica Manual " + UUID.randomUUID().toString().substring(0, 8);
        String body = "{\"name\":\"" + name + "\",\"website\":\"https://manual.example.es/" + name.hashCode() + "\"}";

        mockMvc.perform(post("/api/leads").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.created").value(true));

        mockMvc.perform(post("/api/leads").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.created").value(false));

        mockMvc.perform(get("/api/leads/overview"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalLeads").value(greaterThanOrEqualTo(1)))
            .andExpect(jsonPath("$.leadsBySource['LinkedIn (Manual)']").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void manualLeadRequiresName() throws Exception {
        mockMvc.perform(post("/api/leads").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"  \"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void industriesCanBeListedAndChanged() throws Exception {
        mockMvc.perform(get("/api/industries"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[*].id").value(hasItem("real_estate")));

        mockMvc.perform(post("/api/industry").contentType(MediaType.APPLICATION_JSON).content("{\"industry\":\"real_estate\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fellBack").value(false))
            .andExpect(jsonPath("$.industry.id").value("real_estate"));

        mockMvc.perform(get("/api/industry"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("Real Estate"));

        mockMvc.perform(post("/api/industry").contentType(MediaType.APPLICATION_JSON).content("{\"industry\":\"bogus\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fellBack").value(true))
            .andExpect(jsonPath("$.industry.id").value("medical_aesthetics"));
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (jobState.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }
}
