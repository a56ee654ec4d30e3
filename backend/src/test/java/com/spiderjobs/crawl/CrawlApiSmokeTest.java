package com.spiderjobs.crawl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsIdleCrawlerAndConfiguredSites() throws Exception {
        mockMvc.perform(get("/api/crawl/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.frontier[0].siteId").value("test-site"));
    }

    @Test
    void metricsIncludeSiteBreakerState() throws Exception {
        mockMvc.perform(get("/api/crawl/metrics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sites[0].siteId").value("test-site"))
            .andExpect(jsonPath("$.sites[0].breakerState").value("CLOSED"))
            .andExpect(jsonPath("$.proxies[0].identityId").value("direct"));
    }

    @Test
    void pauseAndResumeAreReflectedInStatus() throws Exception {
        mockMvc.perform(post("/api/crawl/sites/test-site/pause"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pausedSites", hasItem("test-site")));

        mockMvc.perform(post("/api/crawl/sites/test-site/resume"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pausedSites.length()").value(0));
    }

    @Test
    void unknownSiteIsNotFound() throws Exception {
        mockMvc.perform(post("/api/crawl/sites/nowhere/pause"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_site"));
    }

    @Test
    void seedReportsAdmissionPerUrl() throws Exception {
        String body = "{\"urls\":[\"http://localhost:9/jobs?smoke=1\",\"not a url\"]}";

        mockMvc.perform(post("/api/crawl/sites/test-site/seed")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$['http://localhost:9/jobs?smoke=1']").value("ADMITTED"))
            .andExpect(jsonPath("$['not a url']").value("INVALID_URL"));

        mockMvc.perform(post("/api/crawl/sites/test-site/seed")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"urls\":[\"http://localhost:9/jobs?smoke=1\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$['http://localhost:9/jobs?smoke=1']").value("DUPLICATE"));
    }

    @Test
    void startTwiceConflictsThenStopSummarises() throws Exception {
        mockMvc.perform(post("/api/crawl/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"siteIds\":[\"test-site\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true))
            .andExpect(jsonPath("$.workerCount").value(2));

        mockMvc.perform(post("/api/crawl/start"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("crawl_already_running"));

        mockMvc.perform(post("/api/crawl/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false));
    }
}
