package com.jobcache.janitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "cleanup")
public class CleanupProperties {
    private static final List<String> DEFAULT_ALLOWED_HEADERS =
        List.of("authorization", "x-client-info", "apikey", "content-type");

    private int staleSearchDays = 30;
    private int orphanSearchDays = 60;
    private int orphanBatchSize = 200;
    private Schedule schedule = new Schedule();
    private Cli cli = new Cli();
    private Cors cors = new Cors();

    public int getStaleSearchDays() {
        return Math.max(1, staleSearchDays);
    }

    public void setStaleSearchDays(int staleSearchDays) {
        this.staleSearchDays = Math.max(1, staleSearchDays);
    }

    public int getOrphanSearchDays() {
        return Math.max(1, orphanSearchDays);
    }

    public void setOrphanSearchDays(int orphanSearchDays) {
        this.orphanSearchDays = Math.max(1, orphanSearchDays);
    }

    public int getOrphanBatchSize() {
        return Math.max(1, orphanBatchSize);
    }

    public void setOrphanBatchSize(int orphanBatchSize) {
        this.orphanBatchSize = Math.max(1, orphanBatchSize);
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors;
    }

    public static class Schedule {
        private boolean enabled;
        private long intervalMs = 3_600_000L;
        private long initialDelayMs = 60_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return Math.max(1_000L, intervalMs);
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getInitialDelayMs() {
            return Math.max(0L, initialDelayMs);
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Cors {
        private String allowedOrigin = "*";
        private List<String> allowedHeaders = DEFAULT_ALLOWED_HEADERS;

        public String getAllowedOrigin() {
            return allowedOrigin == null || allowedOrigin.isBlank() ? "*" : allowedOrigin.trim();
        }

        public void setAllowedOrigin(String allowedOrigin) {
            this.allowedOrigin = allowedOrigin;
        }

        public List<String> getAllowedHeaders() {
            return allowedHeaders == null || allowedHeaders.isEmpty() ? DEFAULT_ALLOWED_HEADERS : allowedHeaders;
        }

        public void setAllowedHeaders(List<String> allowedHeaders) {
            this.allowedHeaders = allowedHeaders;
        }
    }
}
