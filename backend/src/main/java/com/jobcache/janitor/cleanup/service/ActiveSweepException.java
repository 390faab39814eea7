package com.jobcache.janitor.cleanup.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveSweepException extends RuntimeException {
    public ActiveSweepException(String message) {
        super(message);
    }
}
