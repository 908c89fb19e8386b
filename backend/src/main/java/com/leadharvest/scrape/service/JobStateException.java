package com.leadharvest.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class JobStateException extends RuntimeException {
    public JobStateException(String message) {
        super(message);
    }
}
