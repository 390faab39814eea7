package com.jobcache.janitor.cleanup.api;

import com.jobcache.janitor.cleanup.model.CleanupSummary;
import com.jobcache.janitor.cleanup.service.CacheSweepService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CleanupController {
    private final CacheSweepService cacheSweepService;

    public CleanupController(CacheSweepService cacheSweepService) {
        this.cacheSweepService = cacheSweepService;
    }

    @RequestMapping(
        path = "/cleanup-jobs",
        method = {RequestMethod.POST, RequestMethod.GET},
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    public CleanupSummary cleanupJobs() {
        return cacheSweepService.sweep();
    }
}
