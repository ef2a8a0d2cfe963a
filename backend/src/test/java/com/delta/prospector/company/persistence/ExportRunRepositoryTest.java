package com.delta.prospector.company.persistence;

import com.delta.prospector.company.model.ExportRunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ExportRunRepositoryTest {

    @Autowired
    private ExportRunRepository repository;
    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void clearRuns() {
        jdbc.getJdbcTemplate().update("DELETE FROM export_artifacts");
        jdbc.getJdbcTemplate().update("DELETE FROM export_runs");
    }

    @Test
    void runsInsertedAtSameInstantGetTheirOwnIds() {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");

        long first = repository.insertRun(1, null, "{\"min_employees\":50}", now);
        long second = repository.insertRun(7, first, "{\"min_employees\":60}", now);

        assertThat(second).isNotEqualTo(first);
        ExportRunState firstRun = repository.findRun(first);
        ExportRunState secondRun = repository.findRun(second);
        assertThat(firstRun.startPage()).isEqualTo(1);
        assertThat(firstRun.filtersJson()).contains("50");
        assertThat(secondRun.startPage()).isEqualTo(7);
        assertThat(secondRun.lastSuccessfulPage()).isEqualTo(6);
        assertThat(secondRun.resumedFromRunId()).isEqualTo(first);
    }
}
