package com.pricetrack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_ZONE_ID = "America/Halifax";
    private static final String DEFAULT_USER_AGENT = "price-job-tracker/0.1 (+contact)";

    private String zoneId = DEFAULT_ZONE_ID;
    private Retry retry = new Retry();
    private Workers workers = new Workers();
    private Queue queue = new Queue();
    private History history = new History();
    private Extraction extraction = new Extraction();
    private Jobs jobs = new Jobs();
    private Cli cli = new Cli();

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = (zoneId == null || zoneId.isBlank()) ? DEFAULT_ZONE_ID : zoneId.trim();
    }

    public ZoneId zone() {
        return ZoneId.of(getZoneId());
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialDelayMs = 5000;
        private double backoffFactor = 2.0;
        private boolean retryOnEmptyResult = true;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getInitialDelayMs() {
            return Math.max(0L, initialDelayMs);
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = Math.max(0L, initialDelayMs);
        }

        public double getBackoffFactor() {
            return Math.max(1.0, backoffFactor);
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = Math.max(1.0, backoffFactor);
        }

        public boolean isRetryOnEmptyResult() {
            return retryOnEmptyResult;
        }

        public void setRetryOnEmptyResult(boolean retryOnEmptyResult) {
            this.retryOnEmptyResult = retryOnEmptyResult;
        }
    }

    public static class Workers {
        private boolean enabled = true;
        private int workerCount = 2;
        private int pollIntervalMs = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(50, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(50, pollIntervalMs);
        }
    }

    public static class Queue {
        private String backend = "jdbc";
        private long leaseSeconds = 600;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public long getLeaseSeconds() {
            return Math.max(1L, leaseSeconds);
        }

        public void setLeaseSeconds(long leaseSeconds) {
            this.leaseSeconds = Math.max(1L, leaseSeconds);
        }
    }

    public static class History {
        private String backend = "mongo";
        private String collection = "price_history";

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    public static class Extraction {
        private String productUrlTemplate = "https://www.bestbuy.ca/en-ca/product/{webCode}";
        private String userAgent;
        private int timeoutMs = 20000;

        public String getProductUrlTemplate() {
            return productUrlTemplate;
        }

        public void setProductUrlTemplate(String productUrlTemplate) {
            this.productUrlTemplate = productUrlTemplate;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getTimeoutMs() {
            return Math.max(1000, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(1000, timeoutMs);
        }
    }

    public static class Jobs {
        private int staleMinutes = 60;
        private boolean failStaleOnStartup = false;
        private int defaultListLimit = 50;
        private int maxWebCodeLength = 64;

        public int getStaleMinutes() {
            return Math.max(1, staleMinutes);
        }

        public void setStaleMinutes(int staleMinutes) {
            this.staleMinutes = Math.max(1, staleMinutes);
        }

        public boolean isFailStaleOnStartup() {
            return failStaleOnStartup;
        }

        public void setFailStaleOnStartup(boolean failStaleOnStartup) {
            this.failStaleOnStartup = failStaleOnStartup;
        }

        public int getDefaultListLimit() {
            return Math.max(1, defaultListLimit);
        }

        public void setDefaultListLimit(int defaultListLimit) {
            this.defaultListLimit = Math.max(1, defaultListLimit);
        }

        public int getMaxWebCodeLength() {
            return Math.max(1, maxWebCodeLength);
        }

        public void setMaxWebCodeLength(int maxWebCodeLength) {
            this.maxWebCodeLength = Math.max(1, maxWebCodeLength);
        }
    }

    public static class Cli {
        private boolean run;
        private String watchlistCsv = "../data/watchlist.csv";
        private boolean exitAfterSubmit = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getWatchlistCsv() {
            return watchlistCsv;
        }

        public void setWatchlistCsv(String watchlistCsv) {
            this.watchlistCsv = watchlistCsv;
        }

        public boolean isExitAfterSubmit() {
            return exitAfterSubmit;
        }

        public void setExitAfterSubmit(boolean exitAfterSubmit) {
            this.exitAfterSubmit = exitAfterSubmit;
        }
    }
}
