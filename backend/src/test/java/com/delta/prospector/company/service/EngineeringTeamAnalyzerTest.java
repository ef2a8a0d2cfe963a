package com.delta.prospector.company.service;

import com.delta.prospector.company.model.EngineeringAnalysis;
import com.delta.prospector.company.model.EngineeringPerson;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.config.ProspectorProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EngineeringTeamAnalyzerTest {
    private final EngineeringTeamAnalyzer analyzer = new EngineeringTeamAnalyzer(new ProspectorProperties());

    @Test
    void leaderKeywordsMatchWholeWordsOnly() {
        PeoplePage people = new PeoplePage(List.of(
            new EngineeringPerson("A", "CTO", null, null),
            new EngineeringPerson("B", "Head of Platform", null, null),
            new EngineeringPerson("C", "Leadership Development Engineer", null, null),
            new EngineeringPerson("D", "Software Engineer", null, null),
            new EngineeringPerson("E", null, null, null)
        ), 5);

        EngineeringAnalysis analysis = analyzer.analyze(people, 50);

        assertThat(analysis.engineeringLeaders()).extracting(EngineeringPerson::name).containsExactly("A", "B");
        assertThat(analysis.engineeringEmployees()).hasSize(5);
    }

    @Test
    void percentageUsesCompanyHeadcountWhenKnown() {
        PeoplePage people = new PeoplePage(List.of(new EngineeringPerson("A", "Software Engineer", null, null)), 7);

        EngineeringAnalysis analysis = analyzer.analyze(people, 300);

        assertThat(analysis.engineeringCount()).isEqualTo(7);
        assertThat(analysis.totalEmployees()).isEqualTo(300);
        assertThat(analysis.engineeringPercentage()).isEqualTo(2.33);
    }

    @Test
    void unknownHeadcountFallsBackToMatchedPeople() {
        PeoplePage people = new PeoplePage(List.of(
            new EngineeringPerson("A", "Software Engineer", null, null),
            new EngineeringPerson("B", "Principal Engineer", null, null)
        ), 2);

        EngineeringAnalysis analysis = analyzer.analyze(people, null);

        assertThat(analysis.totalEmployees()).isEqualTo(2);
        assertThat(analysis.engineeringPercentage()).isEqualTo(100.0);
        assertThat(analysis.error()).isNull();
    }
}
