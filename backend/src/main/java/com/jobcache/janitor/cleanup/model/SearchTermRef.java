package com.jobcache.janitor.cleanup.model;

import java.util.UUID;

public record SearchTermRef(UUID id, String canonicalTerm) {
}
