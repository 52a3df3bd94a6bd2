package com.designauditor.crawl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class AnalysisApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void startEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/analysis/some-job/cancel"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/analysis/does-not-exist/status"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("job_not_found"));
    }

    @Test
    void startWithoutDomainIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void listIsAnArray() throws Exception {
        mockMvc.perform(get("/api/analysis"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void consolidateEndpointIsWired() throws Exception {
        String body = "[{\"hex\":\"#FFF\",\"usedAs\":\"background\",\"pageUrl\":\"https://example.com/\","
            + "\"elementTag\":\"DIV\",\"selector\":\"div\",\"contextSnippet\":\"\"}]";
        mockMvc.perform(post("/api/colors/consolidate").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.table.clusters['#ffffff'].count").value(1))
            .andExpect(jsonPath("$.summary.neutrals[0]").value("#ffffff"));
    }
}
