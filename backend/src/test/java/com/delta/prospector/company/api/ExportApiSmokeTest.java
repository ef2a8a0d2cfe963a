package com.delta.prospector.company.api;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.service.CompanyDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ExportApiSmokeTest {

    @Autowired
    private WebApplicationContext context;
    @Autowired
    private NamedParameterJdbcTemplate jdbc;
    @Autowired
    private QueryCacheStore cacheStore;

    @MockBean
    private CompanyDataSource dataSource;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        cacheStore.clear();
        jdbc.getJdbcTemplate().update("DELETE FROM export_artifacts");
        jdbc.getJdbcTemplate().update("DELETE FROM export_runs");
    }

    @Test
    void statusIsIdleBeforeAnyExport() throws Exception {
        mockMvc.perform(get("/api/export/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("IDLE"))
            .andExpect(jsonPath("$.total_companies").value(0))
            .andExpect(jsonPath("$.can_resume").value(false));
    }

    @Test
    void startReturnsCsvAttachmentAndRunHeaders() throws Exception {
        when(dataSource.fetchCompanyPage(any(), eq(1), anyInt())).thenReturn(new CompanyPage(List.of(
            new CompanyRecord("Acme", "acme.io", null, 150, "Austin, Texas, United States", "software", 2018, "series_a", 5.0e6)
        ), 1));

        mockMvc.perform(post("/api/export/start").contentType(MediaType.APPLICATION_JSON).content("{\"start_page\":1}"))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Export-Status", "COMPLETED"))
            .andExpect(header().string("X-Export-Last-Successful-Page", "1"))
            .andExpect(header().string("Content-Disposition", containsString("companies_export_")))
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(content().string(startsWith("name,website,linkedin_url")))
            .andExpect(content().string(containsString("Acme,acme.io,N/A,150")));

        mockMvc.perform(get("/api/export/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.total_companies").value(1))
            .andExpect(jsonPath("$.last_successful_page").value(1));
    }

    @Test
    void startWithNoMatchesIsNotFound() throws Exception {
        when(dataSource.fetchCompanyPage(any(), anyInt(), anyInt())).thenReturn(new CompanyPage(List.of(), 0));

        mockMvc.perform(post("/api/export/start"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.reason").value("no_companies"))
            .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void invalidStartPageIsRejected() throws Exception {
        mockMvc.perform(post("/api/export/start").contentType(MediaType.APPLICATION_JSON).content("{\"start_page\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.reason").value("invalid_request"));
        verifyNoInteractions(dataSource);
    }

    @Test
    void resumeWithoutFailedRunConflicts() throws Exception {
        mockMvc.perform(post("/api/export/resume"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.reason").value("nothing_to_resume"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/export/runs/987654"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.reason").value("not_found"));
        mockMvc.perform(get("/api/export/runs/987654/artifact"))
            .andExpect(status().isNotFound());
    }

    @Test
    void searchRejectsInvertedBounds() throws Exception {
        mockMvc.perform(post("/api/companies/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"min_employees\":\"500\",\"max_employees\":\"100\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("min_employees must not exceed max_employees"));

        mockMvc.perform(post("/api/companies/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"min_employees\":\"fifty\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.reason").value("invalid_request"));
        verifyNoInteractions(dataSource);
    }

    @Test
    void searchReturnsPageWithTotals() throws Exception {
        when(dataSource.countCompanies(any())).thenReturn(12L);
        when(dataSource.fetchCompanyPage(any(), eq(2), eq(10))).thenReturn(new CompanyPage(List.of(
            new CompanyRecord("Beta", "beta.dev", null, 80, null, null, null, "series_b", null),
            new CompanyRecord("Gamma", "gamma.dev", null, 90, null, null, null, "series_b", null)
        ), 12));

        mockMvc.perform(post("/api/companies/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"min_employees\":\"50\",\"funding_stages\":[\"series_b\"],\"page\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(12))
            .andExpect(jsonPath("$.total_pages").value(2))
            .andExpect(jsonPath("$.companies.length()").value(2))
            .andExpect(jsonPath("$.companies[0].name").value("Beta"));
    }

    @Test
    void analyzeRequiresNameOrDomain() throws Exception {
        mockMvc.perform(post("/api/companies/analyze").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.reason").value("invalid_request"));
    }

    @Test
    void cacheClearReportsRemovedEntries() throws Exception {
        when(dataSource.countCompanies(any())).thenReturn(3L);
        when(dataSource.fetchCompanyPage(any(), eq(1), anyInt())).thenReturn(new CompanyPage(List.of(), 3));
        mockMvc.perform(post("/api/companies/search").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(2));
        mockMvc.perform(delete("/api/cache/does-not-exist"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(0));
    }
}
