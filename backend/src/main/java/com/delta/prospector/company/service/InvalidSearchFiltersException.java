package com.delta.prospector.company.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidSearchFiltersException extends RuntimeException {
    public InvalidSearchFiltersException(String message) {
        super(message);
    }
}
