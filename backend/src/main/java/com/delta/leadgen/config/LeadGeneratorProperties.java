package com.delta.leadgen.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "leadgen")
public class LeadGeneratorProperties {
    private static final String DEFAULT_USER_AGENT = "delta-lead-generator/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private Retry retry = new Retry();
    private Jobs jobs = new Jobs();
    private Gemini gemini = new Gemini();
    private Scraper scraper = new Scraper();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
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
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Gemini getGemini() {
        return gemini;
    }

    public void setGemini(Gemini gemini) {
        this.gemini = gemini;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 5;
        private long initialDelayMs = 2000;
        private long maxDelayMs = 60000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getInitialDelayMs() {
            return Math.max(0, initialDelayMs);
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = Math.max(0, initialDelayMs);
        }

        public long getMaxDelayMs() {
            return Math.max(getInitialDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public Duration initialDelay() {
            return Duration.ofMillis(getInitialDelayMs());
        }

        public Duration maxDelay() {
            return Duration.ofMillis(getMaxDelayMs());
        }
    }

    public static class Jobs {
        private int workerThreads = 4;
        private int listLimit = 50;

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }

        public int getListLimit() {
            return Math.max(1, listLimit);
        }

        public void setListLimit(int listLimit) {
            this.listLimit = Math.max(1, listLimit);
        }
    }

    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
        private String apiKey;
        private String model = "gemini-2.5-pro";
        private int timeoutSeconds = 120;

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
            this.apiKey = apiKey == null ? null : apiKey.trim();
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Scraper {
        private int maxPagesPerCompany = 3;
        private int maxBodyBytes = 2 * 1024 * 1024;
        private List<String> contactPaths = new ArrayList<>(List.of("/contact", "/contact-us", "/about"));

        public int getMaxPagesPerCompany() {
            return Math.max(1, maxPagesPerCompany);
        }

        public void setMaxPagesPerCompany(int maxPagesPerCompany) {
            this.maxPagesPerCompany = Math.max(1, maxPagesPerCompany);
        }

        public int getMaxBodyBytes() {
            return Math.max(1024, maxBodyBytes);
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = Math.max(1024, maxBodyBytes);
        }

        public List<String> getContactPaths() {
            return contactPaths;
        }

        public void setContactPaths(List<String> contactPaths) {
            this.contactPaths = contactPaths == null ? new ArrayList<>() : new ArrayList<>(contactPaths);
        }
    }
}
