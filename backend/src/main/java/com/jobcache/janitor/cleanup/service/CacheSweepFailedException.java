package com.jobcache.janitor.cleanup.service;

public class CacheSweepFailedException extends RuntimeException {
    private final String stage;

    public CacheSweepFailedException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
