package com.leadharvest.config;

import com.leadharvest.scrape.model.AreaTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {
    private static final String DEFAULT_CLIENT_ID = "default";

    private Jobs jobs = new Jobs();
    private Planner planner = new Planner();
    private Pagination pagination = new Pagination();
    private Retry retry = new Retry();
    private Storage storage = new Storage();
    private Catalog catalog = new Catalog();
    private Provider provider = new Provider();
    private Cli cli = new Cli();

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Planner getPlanner() {
        return planner;
    }

    public void setPlanner(Planner planner) {
        this.planner = planner;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeClientId(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_CLIENT_ID;
        }
        return candidate.trim();
    }

    public static class Jobs {
        private int maxConcurrentJobs = 4;
        private String defaultClientId = DEFAULT_CLIENT_ID;
        private boolean autoStart = true;
        private boolean restartInFlightArea = true;
        private boolean autoResumeOnStartup = false;
        private int listDefaultLimit = 50;
        private int errorListLimit = 100;

        public int getMaxConcurrentJobs() {
            return Math.max(1, maxConcurrentJobs);
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = Math.max(1, maxConcurrentJobs);
        }

        public String getDefaultClientId() {
            return normalizeClientId(defaultClientId);
        }

        public void setDefaultClientId(String defaultClientId) {
            this.defaultClientId = normalizeClientId(defaultClientId);
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public boolean isRestartInFlightArea() {
            return restartInFlightArea;
        }

        public void setRestartInFlightArea(boolean restartInFlightArea) {
            this.restartInFlightArea = restartInFlightArea;
        }

        public boolean isAutoResumeOnStartup() {
            return autoResumeOnStartup;
        }

        public void setAutoResumeOnStartup(boolean autoResumeOnStartup) {
            this.autoResumeOnStartup = autoResumeOnStartup;
        }

        public int getListDefaultLimit() {
            return Math.max(1, Math.min(listDefaultLimit, 500));
        }

        public void setListDefaultLimit(int listDefaultLimit) {
            this.listDefaultLimit = Math.max(1, Math.min(listDefaultLimit, 500));
        }

        public int getErrorListLimit() {
            return Math.max(1, errorListLimit);
        }

        public void setErrorListLimit(int errorListLimit) {
            this.errorListLimit = Math.max(1, errorListLimit);
        }
    }

    public static class Planner {
        private int leadsPerPage = 20;
        private double safetyFactor = 1.5;
        private double costPerPage = 0.001;

        public int getLeadsPerPage() {
            return Math.max(1, leadsPerPage);
        }

        public void setLeadsPerPage(int leadsPerPage) {
            this.leadsPerPage = Math.max(1, leadsPerPage);
        }

        public double getSafetyFactor() {
            return Math.max(1.0, safetyFactor);
        }

        public void setSafetyFactor(double safetyFactor) {
            this.safetyFactor = Math.max(1.0, safetyFactor);
        }

        public double getCostPerPage() {
            return Math.max(0.0, costPerPage);
        }

        public void setCostPerPage(double costPerPage) {
            this.costPerPage = Math.max(0.0, costPerPage);
        }
    }

    public static class Pagination {
        private int earlyExitThreshold = 5;

        public int getEarlyExitThreshold() {
            return Math.max(1, earlyExitThreshold);
        }

        public void setEarlyExitThreshold(int earlyExitThreshold) {
            this.earlyExitThreshold = Math.max(1, earlyExitThreshold);
        }
    }

    public static class Retry {
        private int maxAttempts = 4;
        private long baseDelayMs = 500;
        private long maxDelayMs = 10_000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public long getMaxDelayMs() {
            return Math.max(getBaseDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Storage {
        private int maxAttempts = 3;
        private long retryDelayMs = 200;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }
    }

    public static class Catalog {
        private String csvPath = "classpath:areas/areas.csv";
        private AreaTier unknownPopulationTier = AreaTier.LOW;
        private boolean loadOnStartup = true;

        public String getCsvPath() {
            return csvPath;
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }

        public AreaTier getUnknownPopulationTier() {
            return unknownPopulationTier == null ? AreaTier.LOW : unknownPopulationTier;
        }

        public void setUnknownPopulationTier(AreaTier unknownPopulationTier) {
            this.unknownPopulationTier = unknownPopulationTier;
        }

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }
    }

    public static class Provider {
        private String baseUrl = "https://google-maps-extractor2.p.rapidapi.com";
        private String apiKey;
        private String host = "google-maps-extractor2.p.rapidapi.com";
        private int pageSize = 20;
        private String language = "en";
        private int requestTimeoutSeconds = 30;
        private int minIntervalMs = 250;
        private int maxConcurrentRequests = 2;
        private int rateLimitBackoffSeconds = 30;
        private String source = "google_maps";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public String getLanguage() {
            return language == null || language.isBlank() ? "en" : language.trim();
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMinIntervalMs() {
            return Math.max(0, minIntervalMs);
        }

        public void setMinIntervalMs(int minIntervalMs) {
            this.minIntervalMs = Math.max(0, minIntervalMs);
        }

        public int getMaxConcurrentRequests() {
            return Math.max(1, maxConcurrentRequests);
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
        }

        public int getRateLimitBackoffSeconds() {
            return Math.max(0, rateLimitBackoffSeconds);
        }

        public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
            this.rateLimitBackoffSeconds = Math.max(0, rateLimitBackoffSeconds);
        }

        public String getSource() {
            return source == null || source.isBlank() ? "google_maps" : source.trim();
        }

        public void setSource(String source) {
            this.source = source;
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = true;
        private String query = "";
        private String country = "";
        private String clientId;
        private int minPopulation = 0;
        private int maxPriority = 3;
        private int targetLeadCount = 100;
        private long pollIntervalMs = 2000;

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

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getCountry() {
            return country;
        }

        public void setCountry(String country) {
            this.country = country;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public int getMinPopulation() {
            return Math.max(0, minPopulation);
        }

        public void setMinPopulation(int minPopulation) {
            this.minPopulation = Math.max(0, minPopulation);
        }

        public int getMaxPriority() {
            return Math.max(1, Math.min(maxPriority, 3));
        }

        public void setMaxPriority(int maxPriority) {
            this.maxPriority = Math.max(1, Math.min(maxPriority, 3));
        }

        public int getTargetLeadCount() {
            return Math.max(1, targetLeadCount);
        }

        public void setTargetLeadCount(int targetLeadCount) {
            this.targetLeadCount = Math.max(1, targetLeadCount);
        }

        public long getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }
    }
}
