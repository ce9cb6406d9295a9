package com.taggernews.config;

import com.taggernews.ingest.error.InvalidConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "taggernews")
public class IngestionProperties {
    private static final String DEFAULT_USER_AGENT = "taggernews-ingest/0.1 (+contact)";

    private int staleRunMinutes = 30;
    private ContentSource contentSource = new ContentSource();
    private Fetch fetch = new Fetch();
    private Continuous continuous = new Continuous();
    private Backfill backfill = new Backfill();
    private Recovery recovery = new Recovery();
    private Enrichment enrichment = new Enrichment();
    private Agent agent = new Agent();
    private Scheduler scheduler = new Scheduler();
    private TimingLog timingLog = new TimingLog();

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public ContentSource getContentSource() {
        return contentSource;
    }

    public void setContentSource(ContentSource contentSource) {
        this.contentSource = contentSource;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Continuous getContinuous() {
        return continuous;
    }

    public void setContinuous(Continuous continuous) {
        this.continuous = continuous;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public void setBackfill(Backfill backfill) {
        this.backfill = backfill;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Agent getAgent() {
        return agent;
    }

    public void setAgent(Agent agent) {
        this.agent = agent;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public TimingLog getTimingLog() {
        return timingLog;
    }

    public void setTimingLog(TimingLog timingLog) {
        this.timingLog = timingLog;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    /**
     * Checks every interval, batch size and threshold that a job depends on.
     * Called once at startup, before anything is scheduled.
     *
     * @throws InvalidConfigurationException listing every invalid key
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        requirePositive(problems, "taggernews.continuous.interval", continuous.getInterval());
        requirePositive(problems, "taggernews.continuous.batch-size", continuous.getBatchSize());
        requireNonNegative(problems, "taggernews.continuous.top-stories-refresh-limit", continuous.getTopStoriesRefreshLimit());
        requirePositive(problems, "taggernews.backfill.interval", backfill.getInterval());
        requirePositive(problems, "taggernews.backfill.batch-size", backfill.getBatchSize());
        requirePositive(problems, "taggernews.backfill.max-batches", backfill.getMaxBatches());
        requirePositive(problems, "taggernews.backfill.horizon-days", backfill.getHorizonDays());
        requirePositive(problems, "taggernews.recovery.interval", recovery.getInterval());
        requirePositive(problems, "taggernews.recovery.max-attempts", recovery.getMaxAttempts());
        requirePositive(problems, "taggernews.recovery.batch-limit", recovery.getBatchLimit());
        if (recovery.getGracePeriod() == null || recovery.getGracePeriod().isNegative()) {
            problems.add("taggernews.recovery.grace-period must not be negative");
        }
        requireNonNegative(problems, "taggernews.fetch.max-retries", fetch.getMaxRetries());
        requirePositive(problems, "taggernews.enrichment.batch-size", enrichment.getBatchSize());
        if (enrichment.isEnabled() && (enrichment.getApiKey() == null || enrichment.getApiKey().isBlank())) {
            problems.add("taggernews.enrichment.api-key is required when enrichment is enabled");
        }
        requirePositive(problems, "taggernews.agent.interval", agent.getInterval());
        requirePositive(problems, "taggernews.agent.window-days", agent.getWindowDays());
        requirePositive(problems, "taggernews.agent.min-tag-usage", agent.getMinTagUsage());
        requirePositive(problems, "taggernews.agent.max-proposals", agent.getMaxProposals());
        requireNonNegative(problems, "taggernews.agent.auto-approve-max-affected", agent.getAutoApproveMaxAffected());
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
    }

    private static void requirePositive(List<String> problems, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(key + " must be a positive duration");
        }
    }

    private static void requirePositive(List<String> problems, String key, long value) {
        if (value <= 0) {
            problems.add(key + " must be positive (was " + value + ")");
        }
    }

    private static void requireNonNegative(List<String> problems, String key, long value) {
        if (value < 0) {
            problems.add(key + " must not be negative (was " + value + ")");
        }
    }

    public static class ContentSource {
        private String baseUrl = "https://hacker-news.firebaseio.com/v0";
        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private int minRequestIntervalMs = 0;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMinRequestIntervalMs() {
            return Math.max(0, minRequestIntervalMs);
        }

        public void setMinRequestIntervalMs(int minRequestIntervalMs) {
            this.minRequestIntervalMs = Math.max(0, minRequestIntervalMs);
        }
    }

    public static class Fetch {
        private int maxRetries = 3;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 8000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }
    }

    public static class Continuous {
        private Duration interval = Duration.ofMinutes(2);
        private int batchSize = 50;
        private int itemDelayMs = 50;
        private Long startCursor;
        private int topStoriesRefreshLimit = 30;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getItemDelayMs() {
            return Math.max(0, itemDelayMs);
        }

        public void setItemDelayMs(int itemDelayMs) {
            this.itemDelayMs = Math.max(0, itemDelayMs);
        }

        public Long getStartCursor() {
            return startCursor;
        }

        public void setStartCursor(Long startCursor) {
            this.startCursor = startCursor;
        }

        public int getTopStoriesRefreshLimit() {
            return topStoriesRefreshLimit;
        }

        public void setTopStoriesRefreshLimit(int topStoriesRefreshLimit) {
            this.topStoriesRefreshLimit = topStoriesRefreshLimit;
        }
    }

    public static class Backfill {
        private Duration interval = Duration.ofMinutes(5);
        private int batchSize = 100;
        private int maxBatches = 50;
        private int horizonDays = 7;
        private Long startId;
        private int itemDelayMs = 50;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxBatches() {
            return maxBatches;
        }

        public void setMaxBatches(int maxBatches) {
            this.maxBatches = maxBatches;
        }

        public int getHorizonDays() {
            return horizonDays;
        }

        public void setHorizonDays(int horizonDays) {
            this.horizonDays = horizonDays;
        }

        public Long getStartId() {
            return startId;
        }

        public void setStartId(Long startId) {
            this.startId = startId;
        }

        public int getItemDelayMs() {
            return Math.max(0, itemDelayMs);
        }

        public void setItemDelayMs(int itemDelayMs) {
            this.itemDelayMs = Math.max(0, itemDelayMs);
        }
    }

    public static class Recovery {
        private Duration interval = Duration.ofMinutes(5);
        private int maxAttempts = 3;
        private Duration gracePeriod = Duration.ofMinutes(10);
        private int batchLimit = 50;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getGracePeriod() {
            return gracePeriod;
        }

        public void setGracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
        }

        public int getBatchLimit() {
            return batchLimit;
        }

        public void setBatchLimit(int batchLimit) {
            this.batchLimit = batchLimit;
        }
    }

    public static class Enrichment {
        private boolean enabled = true;
        private int batchSize = 5;
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private int timeoutSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Agent {
        private Duration interval = Duration.ofDays(7);
        private int windowDays = 30;
        private int minTagUsage = 3;
        private int maxProposals = 10;
        private boolean autoApprove = false;
        private int autoApproveMaxAffected = 5;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getWindowDays() {
            return windowDays;
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = windowDays;
        }

        public int getMinTagUsage() {
            return minTagUsage;
        }

        public void setMinTagUsage(int minTagUsage) {
            this.minTagUsage = minTagUsage;
        }

        public int getMaxProposals() {
            return maxProposals;
        }

        public void setMaxProposals(int maxProposals) {
            this.maxProposals = maxProposals;
        }

        public boolean isAutoApprove() {
            return autoApprove;
        }

        public void setAutoApprove(boolean autoApprove) {
            this.autoApprove = autoApprove;
        }

        public int getAutoApproveMaxAffected() {
            return autoApproveMaxAffected;
        }

        public void setAutoApproveMaxAffected(int autoApproveMaxAffected) {
            this.autoApproveMaxAffected = autoApproveMaxAffected;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInitialDelay() {
            return initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }
    }

    public static class TimingLog {
        private boolean enabled = false;
        private String path = "benchmarking/ingest-timings.csv";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
