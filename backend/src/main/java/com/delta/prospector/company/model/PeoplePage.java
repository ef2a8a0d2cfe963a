package com.delta.prospector.company.model;

import java.util.List;

public record PeoplePage(List<EngineeringPerson> people, long total) {
    public PeoplePage {
        people = people == null ? List.of() : List.copyOf(people);
        total = Math.max(0, total);
    }
}
