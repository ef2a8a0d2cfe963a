package com.delta.prospector.company.service;

import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.EngineeringAnalysis;
import com.delta.prospector.company.model.EngineeringPerson;
import com.delta.prospector.company.model.PersonalizedMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class OutreachMessageComposer {

    public List<PersonalizedMessage> compose(CompanyRecord company, EngineeringAnalysis engineering) {
        if (engineering == null || engineering.hasError()) {
            return List.of();
        }
        List<PersonalizedMessage> messages = new ArrayList<>();
        for (EngineeringPerson leader : engineering.leadersOrEmpty()) {
            messages.add(new PersonalizedMessage(leader, message(company, leader, engineering)));
        }
        return messages;
    }

    private String message(CompanyRecord company, EngineeringPerson leader, EngineeringAnalysis engineering) {
        String greeting = firstName(leader.name()) == null ? "Hi there," : "Hi " + firstName(leader.name()) + ",";
        String companyName = company == null || company.name() == null ? "your company" : company.name();
        String role = leader.title() == null || leader.title().isBlank() ? "an engineering leader" : leader.title();
        Double percentage = engineering.engineeringPercentage();
        String share = percentage == null || percentage <= 0
            ? "a growing engineering organization"
            : "an engineering team that makes up about "
                + String.format(Locale.ROOT, "%.1f", percentage)
                + "% of the company";
        return greeting + " I came across your work as " + role + " at " + companyName
            + ". Leading " + share + " means hiring and tooling decisions carry a lot of weight."
            + " I'd love to hear how you're thinking about scaling the team this year.";
    }

    private String firstName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return null;
        }
        String first = fullName.trim().split("\\s+")[0];
        if (first.isEmpty()) {
            return null;
        }
        return first.substring(0, 1).toUpperCase(Locale.ROOT) + first.substring(1);
    }
}
