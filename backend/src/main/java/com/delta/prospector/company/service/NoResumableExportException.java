package com.delta.prospector.company.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class NoResumableExportException extends RuntimeException {
    public NoResumableExportException(String message) {
        super(message);
    }
}
