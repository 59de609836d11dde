package com.ekslens.leadmaster.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "leadmaster")
public class LeadMasterProperties {
    private static final String DEFAULT_USER_AGENT = "ekslens-lead-master/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private String defaultIndustry = "medical_aesthetics";
    private int logCapacity = 100;
    private Search search = new Search();
    private Augment augment = new Augment();
    private SerpApi serpapi = new SerpApi();
    private LinkedIn linkedin = new LinkedIn();
    private Report report = new Report();
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
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public String getDefaultIndustry() {
        return defaultIndustry;
    }

    public void setDefaultIndustry(String defaultIndustry) {
        this.defaultIndustry = defaultIndustry;
    }

    public int getLogCapacity() {
        return Math.max(1, logCapacity);
    }

    public void setLogCapacity(int logCapacity) {
        this.logCapacity = Math.max(1, logCapacity);
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Augment getAugment() {
        return augment;
    }

    public void setAugment(Augment augment) {
        this.augment = augment;
    }

    public SerpApi getSerpapi() {
        return serpapi;
    }

    public void setSerpapi(SerpApi serpapi) {
        this.serpapi = serpapi;
    }

    public LinkedIn getLinkedin() {
        return linkedin;
    }

    public void setLinkedin(LinkedIn linkedin) {
        this.linkedin = linkedin;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
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

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static class Search {
        private int maxSearches = 10;
        private int maxCities = 5;
        private int maxKeywords = 10;
        private int defaultKeywordCount = 5;
        private List<String> defaultCities = List.of("madrid", "barcelona", "valencia");

        public int getMaxSearches() {
            return Math.max(1, maxSearches);
        }

        public void setMaxSearches(int maxSearches) {
            this.maxSearches = Math.max(1, maxSearches);
        }

        public int getMaxCities() {
            return Math.max(1, maxCities);
        }

        public void setMaxCities(int maxCities) {
            this.maxCities = Math.max(1, maxCities);
        }

        public int getMaxKeywords() {
            return Math.max(1, maxKeywords);
        }

        public void setMaxKeywords(int maxKeywords) {
            this.maxKeywords = Math.max(1, maxKeywords);
        }

        public int getDefaultKeywordCount() {
            return Math.max(1, defaultKeywordCount);
        }

        public void setDefaultKeywordCount(int defaultKeywordCount) {
            this.defaultKeywordCount = Math.max(1, defaultKeywordCount);
        }

        public List<String> getDefaultCities() {
            return defaultCities == null ? List.of() : defaultCities;
        }

        public void setDefaultCities(List<String> defaultCities) {
            this.defaultCities = defaultCities;
        }
    }

    public static class Augment {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-pro";
        private int sampleSize = 5;
        private int timeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return enabled && hasText(apiKey) && hasText(baseUrl);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getSampleSize() {
            return Math.max(0, sampleSize);
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = Math.max(0, sampleSize);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class SerpApi {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://serpapi.com/search.json";
        private int delayMs = 2000;
        private int resultsPerSearch = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return enabled && hasText(apiKey) && hasText(baseUrl);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getDelayMs() {
            return Math.max(1, delayMs);
        }

        public void setDelayMs(int delayMs) {
            this.delayMs = Math.max(1, delayMs);
        }

        public int getResultsPerSearch() {
            return Math.max(1, resultsPerSearch);
        }

        public void setResultsPerSearch(int resultsPerSearch) {
            this.resultsPerSearch = Math.max(1, resultsPerSearch);
        }
    }

    public static class LinkedIn {
        private boolean enabled = false;
        private String email;
        private String password;
        private String remoteDriverUrl;
        private String loginUrl = "https://www.linkedin.com/login";
        private String searchUrl = "https://www.linkedin.com/search/results/people/";
        private int delayMs = 4000;
        private int maxCities = 2;
        private int maxTermsPerCity = 8;
        private int pagesPerTerm = 3;
        private int resultsPerPage = 5;
        private int pageLoadTimeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean isConfigured() {
            return enabled && hasText(email) && hasText(password);
        }

        public String getRemoteDriverUrl() {
            return remoteDriverUrl;
        }

        public void setRemoteDriverUrl(String remoteDriverUrl) {
            this.remoteDriverUrl = remoteDriverUrl;
        }

        public String getLoginUrl() {
            return loginUrl;
        }

        public void setLoginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
        }

        public String getSearchUrl() {
            return searchUrl;
        }

        public void setSearchUrl(String searchUrl) {
            this.searchUrl = searchUrl;
        }

        public int getDelayMs() {
            return Math.max(1, delayMs);
        }

        public void setDelayMs(int delayMs) {
            this.delayMs = Math.max(1, delayMs);
        }

        public int getMaxCities() {
            return Math.max(1, maxCities);
        }

        public void setMaxCities(int maxCities) {
            this.maxCities = Math.max(1, maxCities);
        }

        public int getMaxTermsPerCity() {
            return Math.max(1, maxTermsPerCity);
        }

        public void setMaxTermsPerCity(int maxTermsPerCity) {
            this.maxTermsPerCity = Math.max(1, maxTermsPerCity);
        }

        public int getPagesPerTerm() {
            return Math.max(1, pagesPerTerm);
        }

        public void setPagesPerTerm(int pagesPerTerm) {
            this.pagesPerTerm = Math.max(1, pagesPerTerm);
        }

        public int getResultsPerPage() {
            return Math.max(1, resultsPerPage);
        }

        public void setResultsPerPage(int resultsPerPage) {
            this.resultsPerPage = Math.max(1, resultsPerPage);
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = Math.max(1, pageLoadTimeoutSeconds);
        }
    }

    public static class Report {
        private boolean enabled = true;
        private String directory = "session-reports";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Cli {
        private boolean run;
        private String industry;
        private String cities = "";
        private String keywords = "";
        private int maxSearches = 2;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getIndustry() {
            return industry;
        }

        public void setIndustry(String industry) {
            this.industry = industry;
        }

        public String getCities() {
            return cities;
        }

        public void setCities(String cities) {
            this.cities = cities;
        }

        public String getKeywords() {
            return keywords;
        }

        public void setKeywords(String keywords) {
            this.keywords = keywords;
        }

        public int getMaxSearches() {
            return maxSearches;
        }

        public void setMaxSearches(int maxSearches) {
            this.maxSearches = maxSearches;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
