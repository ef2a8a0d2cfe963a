package com.delta.prospector.company.service;

import com.delta.prospector.company.model.EngineeringAnalysis;
import com.delta.prospector.company.model.EngineeringPerson;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.config.ProspectorProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class EngineeringTeamAnalyzer {
    private final ProspectorProperties properties;

    public EngineeringTeamAnalyzer(ProspectorProperties properties) {
        this.properties = properties;
    }

    /**
     * Summarizes an engineering people search. When the company head count is unknown the number of
     * people returned stands in for it, which overstates the engineering share.
     */
    public EngineeringAnalysis analyze(PeoplePage people, Integer companyEmployeeCount) {
        List<EngineeringPerson> engineers = people == null ? List.of() : people.people();
        long matched = people == null ? 0 : Math.max(people.total(), engineers.size());
        int engineeringCount = (int) Math.min(Integer.MAX_VALUE, matched);
        int totalEmployees = companyEmployeeCount != null && companyEmployeeCount > 0
            ? companyEmployeeCount
            : engineeringCount;

        double percentage = totalEmployees == 0
            ? 0.0
            : BigDecimal.valueOf(engineeringCount * 100.0 / totalEmployees)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();

        List<EngineeringPerson> leaders = new ArrayList<>();
        List<Pattern> leaderPatterns = leaderPatterns();
        for (EngineeringPerson person : engineers) {
            if (isLeader(person, leaderPatterns)) {
                leaders.add(person);
            }
        }
        return new EngineeringAnalysis(
            totalEmployees,
            engineeringCount,
            Math.min(100.0, percentage),
            engineers,
            leaders,
            null
        );
    }

    private boolean isLeader(EngineeringPerson person, List<Pattern> patterns) {
        if (person.title() == null || person.title().isBlank()) {
            return false;
        }
        String title = person.title().toLowerCase(Locale.ROOT);
        for (Pattern pattern : patterns) {
            if (pattern.matcher(title).find()) {
                return true;
            }
        }
        return false;
    }

    private List<Pattern> leaderPatterns() {
        List<Pattern> patterns = new ArrayList<>();
        for (String keyword : properties.getAnalysis().getLeaderKeywords()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String normalized = keyword.trim().toLowerCase(Locale.ROOT);
            patterns.add(Pattern.compile("\\b" + Pattern.quote(normalized) + "\\b"));
        }
        return patterns;
    }
}
