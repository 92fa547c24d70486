package com.delta.jobscraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";

    private String sourcesFile = "config.yaml";
    private String cacheDir = "cache";
    private String summaryDir = "logs/summaries";
    private String userAgent;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private Navigation navigation = new Navigation();
    private Download download = new Download();
    private Scheduler scheduler = new Scheduler();
    private Throttle throttle = new Throttle();
    private EarlyStop earlyStop = new EarlyStop();
    private Cli cli = new Cli();

    public String getSourcesFile() {
        return sourcesFile;
    }

    public void setSourcesFile(String sourcesFile) {
        this.sourcesFile = sourcesFile;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public String getSummaryDir() {
        return summaryDir;
    }

    public void setSummaryDir(String summaryDir) {
        this.summaryDir = summaryDir;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Navigation getNavigation() {
        return navigation;
    }

    public void setNavigation(Navigation navigation) {
        this.navigation = navigation;
    }

    public Download getDownload() {
        return download;
    }

    public void setDownload(Download download) {
        this.download = download;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public void setThrottle(Throttle throttle) {
        this.throttle = throttle;
    }

    public EarlyStop getEarlyStop() {
        return earlyStop;
    }

    public void setEarlyStop(EarlyStop earlyStop) {
        this.earlyStop = earlyStop;
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

    public static class Navigation {
        private int maxRetries = 3;
        private int retryDelayMs = 5000;
        private int settleMs = 2000;
        private int selectorWaitMs = 20000;
        private int selectorPollMs = 500;

        public int getMaxRetries() {
            return Math.max(1, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(1, maxRetries);
        }

        public int getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }

        public int getSettleMs() {
            return Math.max(0, settleMs);
        }

        public void setSettleMs(int settleMs) {
            this.settleMs = Math.max(0, settleMs);
        }

        public int getSelectorWaitMs() {
            return Math.max(0, selectorWaitMs);
        }

        public void setSelectorWaitMs(int selectorWaitMs) {
            this.selectorWaitMs = Math.max(0, selectorWaitMs);
        }

        public int getSelectorPollMs() {
            return Math.max(1, selectorPollMs);
        }

        public void setSelectorPollMs(int selectorPollMs) {
            this.selectorPollMs = Math.max(1, selectorPollMs);
        }
    }

    public static class Download {
        private int maxConsecutiveErrors = 8;
        private int maxBackoffSeconds = 60;
        private boolean shuffle = true;
        private boolean httpFallback = true;

        public int getMaxConsecutiveErrors() {
            return Math.max(1, maxConsecutiveErrors);
        }

        public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
            this.maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
        }

        public int getMaxBackoffSeconds() {
            return Math.max(0, maxBackoffSeconds);
        }

        public void setMaxBackoffSeconds(int maxBackoffSeconds) {
            this.maxBackoffSeconds = Math.max(0, maxBackoffSeconds);
        }

        public boolean isShuffle() {
            return shuffle;
        }

        public void setShuffle(boolean shuffle) {
            this.shuffle = shuffle;
        }

        public boolean isHttpFallback() {
            return httpFallback;
        }

        public void setHttpFallback(boolean httpFallback) {
            this.httpFallback = httpFallback;
        }
    }

    public static class Scheduler {
        private int sourceTimeoutSeconds = 1800;
        private int maxPartitions = 8;

        public int getSourceTimeoutSeconds() {
            return Math.max(1, sourceTimeoutSeconds);
        }

        public void setSourceTimeoutSeconds(int sourceTimeoutSeconds) {
            this.sourceTimeoutSeconds = Math.max(1, sourceTimeoutSeconds);
        }

        public int getMaxPartitions() {
            return Math.max(1, maxPartitions);
        }

        public void setMaxPartitions(int maxPartitions) {
            this.maxPartitions = Math.max(1, maxPartitions);
        }
    }

    public static class Throttle {
        private int floorMs = 1000;
        private int ceilingMs = 60000;

        public int getFloorMs() {
            return Math.max(0, floorMs);
        }

        public void setFloorMs(int floorMs) {
            this.floorMs = Math.max(0, floorMs);
        }

        public int getCeilingMs() {
            return Math.max(getFloorMs(), ceilingMs);
        }

        public void setCeilingMs(int ceilingMs) {
            this.ceilingMs = ceilingMs;
        }
    }

    public static class EarlyStop {
        private boolean enabled = true;
        private int minNewJobsPerPage = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinNewJobsPerPage() {
            return Math.max(0, minNewJobsPerPage);
        }

        public void setMinNewJobsPerPage(int minNewJobsPerPage) {
            this.minNewJobsPerPage = Math.max(0, minNewJobsPerPage);
        }
    }

    public static class Cli {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
