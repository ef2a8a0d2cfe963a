package com.delta.prospector.company.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidAnalysisRequestException extends RuntimeException {
    public InvalidAnalysisRequestException(String message) {
        super(message);
    }
}
