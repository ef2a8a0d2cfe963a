package com.delta.prospector.company.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

public record SearchFilters(
    Integer minEmployees,
    Integer maxEmployees,
    List<String> fundingStages
) {
    public static SearchFilters of(Integer minEmployees, Integer maxEmployees, List<String> fundingStages) {
        return new SearchFilters(minEmployees, maxEmployees, fundingStages).normalized();
    }

    /**
     * Funding stages lowercased, trimmed, de-duplicated and sorted so construction order never matters.
     */
    public SearchFilters normalized() {
        TreeSet<String> stages = new TreeSet<>();
        if (fundingStages != null) {
            for (String stage : fundingStages) {
                if (stage == null) {
                    continue;
                }
                String value = stage.trim().toLowerCase(Locale.ROOT);
                if (!value.isEmpty()) {
                    stages.add(value);
                }
            }
        }
        return new SearchFilters(minEmployees, maxEmployees, List.copyOf(new ArrayList<>(stages)));
    }
}
