package com.delta.prospector.company.model;

public record PersonalizedMessage(EngineeringPerson leader, String message) {}
