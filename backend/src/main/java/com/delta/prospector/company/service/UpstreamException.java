package com.delta.prospector.company.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The upstream data source failed: network, timeout, rate limit, HTTP error or malformed payload.
 */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class UpstreamException extends RuntimeException {
    private final String reasonCode;
    private final Integer httpStatus;

    public UpstreamException(String reasonCode, String message) {
        this(reasonCode, null, message, null);
    }

    public UpstreamException(String reasonCode, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
        this.httpStatus = httpStatus;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
