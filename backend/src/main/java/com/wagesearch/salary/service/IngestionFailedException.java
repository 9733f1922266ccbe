package com.wagesearch.salary.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class IngestionFailedException extends RuntimeException {
    public IngestionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
