package com.spiderjobs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "spiderjobs-crawler/0.1 (+contact)";

    private String userAgent;
    private int workerCount = 3;
    private int requestTimeoutSeconds = 10;
    private int idlePollMs = 200;
    private boolean autoStart = false;
    private List<String> captchaPatterns = new ArrayList<>(List.of(
        "captcha",
        "are you a robot",
        "verify you are human",
        "cf-challenge"
    ));
    private List<Site> sites = new ArrayList<>();
    private Governor governor = new Governor();
    private Breaker breaker = new Breaker();
    private Proxy proxy = new Proxy();
    private Dedup dedup = new Dedup();
    private Sink sink = new Sink();
    private Frontier frontier = new Frontier();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getIdlePollMs() {
        return Math.max(10, idlePollMs);
    }

    public void setIdlePollMs(int idlePollMs) {
        this.idlePollMs = idlePollMs;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public List<String> getCaptchaPatterns() {
        return captchaPatterns;
    }

    public void setCaptchaPatterns(List<String> captchaPatterns) {
        this.captchaPatterns = captchaPatterns == null ? new ArrayList<>() : captchaPatterns;
    }

    public List<Site> getSites() {
        return sites;
    }

    public void setSites(List<Site> sites) {
        this.sites = sites == null ? new ArrayList<>() : sites;
    }

    public Governor getGovernor() {
        return governor;
    }

    public void setGovernor(Governor governor) {
        this.governor = governor;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Sink getSink() {
        return sink;
    }

    public void setSink(Sink sink) {
        this.sink = sink;
    }

    public Frontier getFrontier() {
        return frontier;
    }

    public void setFrontier(Frontier frontier) {
        this.frontier = frontier;
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

    public static class Site {
        private String siteId;
        private List<String> seedUrls = new ArrayList<>();
        private int rateLimitRequests = 1;
        private long rateLimitIntervalMs = 1000;
        private int maxConcurrency = 1;
        private String parserId = "selector";
        private int maxDepth = 2;
        private int priority = 0;
        private Retry retry = new Retry();
        private Pagination pagination = new Pagination();
        private Map<String, String> selectors = new LinkedHashMap<>();

        public String getSiteId() {
            return siteId;
        }

        public void setSiteId(String siteId) {
            this.siteId = siteId;
        }

        public List<String> getSeedUrls() {
            return seedUrls;
        }

        public void setSeedUrls(List<String> seedUrls) {
            this.seedUrls = seedUrls == null ? new ArrayList<>() : seedUrls;
        }

        public int getRateLimitRequests() {
            return Math.max(1, rateLimitRequests);
        }

        public void setRateLimitRequests(int rateLimitRequests) {
            this.rateLimitRequests = Math.max(1, rateLimitRequests);
        }

        public long getRateLimitIntervalMs() {
            return Math.max(1, rateLimitIntervalMs);
        }

        public void setRateLimitIntervalMs(long rateLimitIntervalMs) {
            this.rateLimitIntervalMs = Math.max(1, rateLimitIntervalMs);
        }

        public int getMaxConcurrency() {
            return Math.max(1, maxConcurrency);
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = Math.max(1, maxConcurrency);
        }

        public String getParserId() {
            return parserId;
        }

        public void setParserId(String parserId) {
            this.parserId = parserId;
        }

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public Retry getRetry() {
            return retry;
        }

        public void setRetry(Retry retry) {
            this.retry = retry;
        }

        public Pagination getPagination() {
            return pagination;
        }

        public void setPagination(Pagination pagination) {
            this.pagination = pagination;
        }

        public Map<String, String> getSelectors() {
            return selectors;
        }

        public void setSelectors(Map<String, String> selectors) {
            this.selectors = selectors == null ? new LinkedHashMap<>() : selectors;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseBackoffMs = 1000;
        private long maxBackoffMs = 30000;
        private int maxBlockedAttempts = 5;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseBackoffMs() {
            return Math.max(0, baseBackoffMs);
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = Math.max(0, baseBackoffMs);
        }

        public long getMaxBackoffMs() {
            return Math.max(getBaseBackoffMs(), maxBackoffMs);
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getMaxBlockedAttempts() {
            return Math.max(1, maxBlockedAttempts);
        }

        public void setMaxBlockedAttempts(int maxBlockedAttempts) {
            this.maxBlockedAttempts = Math.max(1, maxBlockedAttempts);
        }
    }

    public static class Pagination {
        private String strategy = "LINKS";
        private String pageParam = "page";
        private int maxPages = 3;

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public String getPageParam() {
            return pageParam;
        }

        public void setPageParam(String pageParam) {
            this.pageParam = pageParam;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }

    public static class Governor {
        private double backoffFactor = 2.0;
        private double maxBackoffMultiplier = 16.0;
        private int recoverySuccesses = 10;

        public double getBackoffFactor() {
            return Math.max(1.0, backoffFactor);
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public double getMaxBackoffMultiplier() {
            return Math.max(1.0, maxBackoffMultiplier);
        }

        public void setMaxBackoffMultiplier(double maxBackoffMultiplier) {
            this.maxBackoffMultiplier = maxBackoffMultiplier;
        }

        public int getRecoverySuccesses() {
            return Math.max(1, recoverySuccesses);
        }

        public void setRecoverySuccesses(int recoverySuccesses) {
            this.recoverySuccesses = Math.max(1, recoverySuccesses);
        }
    }

    public static class Breaker {
        private long windowMs = 60_000;
        private int minimumRequests = 5;
        private double errorRateThreshold = 0.5;
        private long openDurationMs = 120_000;
        private int halfOpenProbes = 1;

        public long getWindowMs() {
            return Math.max(1, windowMs);
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public int getMinimumRequests() {
            return Math.max(1, minimumRequests);
        }

        public void setMinimumRequests(int minimumRequests) {
            this.minimumRequests = Math.max(1, minimumRequests);
        }

        public double getErrorRateThreshold() {
            return Math.min(1.0, Math.max(0.0, errorRateThreshold));
        }

        public void setErrorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
        }

        public long getOpenDurationMs() {
            return Math.max(1, openDurationMs);
        }

        public void setOpenDurationMs(long openDurationMs) {
            this.openDurationMs = openDurationMs;
        }

        public int getHalfOpenProbes() {
            return Math.max(1, halfOpenProbes);
        }

        public void setHalfOpenProbes(int halfOpenProbes) {
            this.halfOpenProbes = Math.max(1, halfOpenProbes);
        }
    }

    public static class Proxy {
        private int maxConsecutiveFailures = 3;
        private long cooldownMs = 300_000;
        private List<Identity> identities = new ArrayList<>();

        public int getMaxConsecutiveFailures() {
            return Math.max(1, maxConsecutiveFailures);
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
        }

        public long getCooldownMs() {
            return Math.max(1, cooldownMs);
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
        }

        public List<Identity> getIdentities() {
            return identities;
        }

        public void setIdentities(List<Identity> identities) {
            this.identities = identities == null ? new ArrayList<>() : identities;
        }
    }

    public static class Identity {
        private String id;
        private String host;
        private Integer port;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers == null ? new LinkedHashMap<>() : headers;
        }
    }

    public static class Dedup {
        private int expectedUrls = 1_000_000;
        private int expectedListings = 1_000_000;
        private double falsePositiveRate = 0.001;
        private int urlExactCapacity = 1_000_000;
        private int contentExactCapacity = 1_000_000;

        public int getExpectedUrls() {
            return Math.max(1000, expectedUrls);
        }

        public void setExpectedUrls(int expectedUrls) {
            this.expectedUrls = expectedUrls;
        }

        public int getExpectedListings() {
            return Math.max(1000, expectedListings);
        }

        public void setExpectedListings(int expectedListings) {
            this.expectedListings = expectedListings;
        }

        public double getFalsePositiveRate() {
            if (falsePositiveRate <= 0.0 || falsePositiveRate >= 1.0) {
                return 0.001;
            }
            return falsePositiveRate;
        }

        public void setFalsePositiveRate(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
        }

        public int getUrlExactCapacity() {
            return Math.max(0, urlExactCapacity);
        }

        public void setUrlExactCapacity(int urlExactCapacity) {
            this.urlExactCapacity = Math.max(0, urlExactCapacity);
        }

        public int getContentExactCapacity() {
            return Math.max(0, contentExactCapacity);
        }

        public void setContentExactCapacity(int contentExactCapacity) {
            this.contentExactCapacity = Math.max(0, contentExactCapacity);
        }
    }

    public static class Sink {
        private String type = "jdbc";
        private int maxAttempts = 3;
        private long baseBackoffMs = 500;
        private long maxBackoffMs = 5000;
        private String csvPath = "outputs/jobs.csv";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseBackoffMs() {
            return Math.max(0, baseBackoffMs);
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = Math.max(0, baseBackoffMs);
        }

        public long getMaxBackoffMs() {
            return Math.max(getBaseBackoffMs(), maxBackoffMs);
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public String getCsvPath() {
            return csvPath;
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }
    }

    public static class Frontier {
        private boolean persistOnStop = true;
        private boolean restoreOnStart = true;

        public boolean isPersistOnStop() {
            return persistOnStop;
        }

        public void setPersistOnStop(boolean persistOnStop) {
            this.persistOnStop = persistOnStop;
        }

        public boolean isRestoreOnStart() {
            return restoreOnStart;
        }

        public void setRestoreOnStart(boolean restoreOnStart) {
            this.restoreOnStart = restoreOnStart;
        }
    }

    public static class Cli {
        private boolean run;
        private String sites = "";
        private long maxRunSeconds = 3600;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSites() {
            return sites;
        }

        public void setSites(String sites) {
            this.sites = sites;
        }

        public long getMaxRunSeconds() {
            return Math.max(1, maxRunSeconds);
        }

        public void setMaxRunSeconds(long maxRunSeconds) {
            this.maxRunSeconds = maxRunSeconds;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
