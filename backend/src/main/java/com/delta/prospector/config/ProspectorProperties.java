package com.delta.prospector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "prospector")
public class ProspectorProperties {
    private static final String DEFAULT_USER_AGENT = "delta-prospector/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private int staleRunMinutes = 0;
    private Upstream upstream = new Upstream();
    private Cache cache = new Cache();
    private Export export = new Export();
    private Search search = new Search();
    private Analysis analysis = new Analysis();
    private Cli cli = new Cli();

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
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    /**
     * Minimum age of a PROCESSING run before the startup runner marks it interrupted.
     * Zero means every PROCESSING run found at startup belongs to a dead process.
     */
    public int getStaleRunMinutes() {
        return Math.max(0, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = staleRunMinutes;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
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

    public static class Upstream {
        private String baseUrl = "https://api.peopledatalabs.com";
        private String apiKey;
        private String companySearchPath = "/v5/company/search";
        private String personSearchPath = "/v5/person/search";
        private int minRequestIntervalMs = 500;
        private int rateLimitBackoffSeconds = 30;
        private List<String> countries = new ArrayList<>(List.of("canada", "united states"));

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

        public String getCompanySearchPath() {
            return companySearchPath;
        }

        public void setCompanySearchPath(String companySearchPath) {
            this.companySearchPath = companySearchPath;
        }

        public String getPersonSearchPath() {
            return personSearchPath;
        }

        public void setPersonSearchPath(String personSearchPath) {
            this.personSearchPath = personSearchPath;
        }

        public int getMinRequestIntervalMs() {
            return Math.max(1, minRequestIntervalMs);
        }

        public void setMinRequestIntervalMs(int minRequestIntervalMs) {
            this.minRequestIntervalMs = Math.max(1, minRequestIntervalMs);
        }

        public int getRateLimitBackoffSeconds() {
            return Math.max(0, rateLimitBackoffSeconds);
        }

        public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
            this.rateLimitBackoffSeconds = rateLimitBackoffSeconds;
        }

        public List<String> getCountries() {
            return countries;
        }

        public void setCountries(List<String> countries) {
            this.countries = countries == null ? new ArrayList<>() : countries;
        }
    }

    public static class Cache {
        private int searchTtlMinutes = 1440;
        private int countTtlMinutes = 1440;
        private int exportTtlMinutes = 240;
        private int lookupTtlMinutes = 1440;
        private int peopleTtlMinutes = 1440;

        public Duration searchTtl() {
            return Duration.ofMinutes(getSearchTtlMinutes());
        }

        public Duration countTtl() {
            return Duration.ofMinutes(getCountTtlMinutes());
        }

        public Duration exportTtl() {
            return Duration.ofMinutes(getExportTtlMinutes());
        }

        public Duration lookupTtl() {
            return Duration.ofMinutes(getLookupTtlMinutes());
        }

        public Duration peopleTtl() {
            return Duration.ofMinutes(getPeopleTtlMinutes());
        }

        public int getSearchTtlMinutes() {
            return Math.max(1, searchTtlMinutes);
        }

        public void setSearchTtlMinutes(int searchTtlMinutes) {
            this.searchTtlMinutes = searchTtlMinutes;
        }

        public int getCountTtlMinutes() {
            return Math.max(1, countTtlMinutes);
        }

        public void setCountTtlMinutes(int countTtlMinutes) {
            this.countTtlMinutes = countTtlMinutes;
        }

        public int getExportTtlMinutes() {
            return Math.max(1, exportTtlMinutes);
        }

        public void setExportTtlMinutes(int exportTtlMinutes) {
            this.exportTtlMinutes = exportTtlMinutes;
        }

        public int getLookupTtlMinutes() {
            return Math.max(1, lookupTtlMinutes);
        }

        public void setLookupTtlMinutes(int lookupTtlMinutes) {
            this.lookupTtlMinutes = lookupTtlMinutes;
        }

        public int getPeopleTtlMinutes() {
            return Math.max(1, peopleTtlMinutes);
        }

        public void setPeopleTtlMinutes(int peopleTtlMinutes) {
            this.peopleTtlMinutes = peopleTtlMinutes;
        }
    }

    public static class Export {
        private int pageSize = 100;
        private int maxPages = 0;
        private int interPageDelayMs = 500;
        private Integer minEmployees = 50;
        private Integer maxEmployees = 1000;
        private List<String> fundingStages = new ArrayList<>(List.of("series_a", "series_b", "series_c"));

        public int getPageSize() {
            return Math.max(1, Math.min(pageSize, 100));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        /**
         * Upper bound on pages fetched by one run; zero disables the cap.
         */
        public int getMaxPages() {
            return Math.max(0, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public int getInterPageDelayMs() {
            return Math.max(0, interPageDelayMs);
        }

        public void setInterPageDelayMs(int interPageDelayMs) {
            this.interPageDelayMs = interPageDelayMs;
        }

        public Integer getMinEmployees() {
            return minEmployees;
        }

        public void setMinEmployees(Integer minEmployees) {
            this.minEmployees = minEmployees;
        }

        public Integer getMaxEmployees() {
            return maxEmployees;
        }

        public void setMaxEmployees(Integer maxEmployees) {
            this.maxEmployees = maxEmployees;
        }

        public List<String> getFundingStages() {
            return fundingStages;
        }

        public void setFundingStages(List<String> fundingStages) {
            this.fundingStages = fundingStages == null ? new ArrayList<>() : fundingStages;
        }
    }

    public static class Search {
        private int defaultPageSize = 10;
        private int maxPageSize = 100;

        public int getDefaultPageSize() {
            return Math.max(1, Math.min(defaultPageSize, getMaxPageSize()));
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return Math.max(1, maxPageSize);
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    public static class Analysis {
        private int peoplePageSize = 100;
        private List<String> engineeringTitles = new ArrayList<>(List.of(
            "software engineer",
            "senior software engineer",
            "principal engineer",
            "engineering manager",
            "engineering lead",
            "director of engineering",
            "vp engineering",
            "cto"
        ));
        private List<String> leaderKeywords = new ArrayList<>(List.of(
            "cto",
            "chief technology",
            "vp",
            "vice president",
            "head",
            "director",
            "manager",
            "lead",
            "principal"
        ));

        public int getPeoplePageSize() {
            return Math.max(1, Math.min(peoplePageSize, 100));
        }

        public void setPeoplePageSize(int peoplePageSize) {
            this.peoplePageSize = peoplePageSize;
        }

        public List<String> getEngineeringTitles() {
            return engineeringTitles;
        }

        public void setEngineeringTitles(List<String> engineeringTitles) {
            this.engineeringTitles = engineeringTitles == null ? new ArrayList<>() : engineeringTitles;
        }

        public List<String> getLeaderKeywords() {
            return leaderKeywords;
        }

        public void setLeaderKeywords(List<String> leaderKeywords) {
            this.leaderKeywords = leaderKeywords == null ? new ArrayList<>() : leaderKeywords;
        }
    }

    public static class Cli {
        private boolean run;
        private int startPage = 1;
        private boolean resume;
        private String outputDir = "exports";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public int getStartPage() {
            return Math.max(1, startPage);
        }

        public void setStartPage(int startPage) {
            this.startPage = startPage;
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
