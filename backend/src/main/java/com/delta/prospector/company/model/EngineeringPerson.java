package com.delta.prospector.company.model;

public record EngineeringPerson(String name, String title, String location, String linkedinUrl) {}
