package com.boardsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "board-sync/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Render render = new Render();
    private Extraction extraction = new Extraction();
    private Ai ai = new Ai();
    private Submission submission = new Submission();
    private Run run = new Run();
    private Data data = new Data();
    private List<Employer> employers = new ArrayList<>();
    private Cli cli = new Cli();

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

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Ai getAi() {
        return ai;
    }

    public void setAi(Ai ai) {
        this.ai = ai;
    }

    public Submission getSubmission() {
        return submission;
    }

    public void setSubmission(Submission submission) {
        this.submission = submission;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public List<Employer> getEmployers() {
        return employers;
    }

    public void setEmployers(List<Employer> employers) {
        this.employers = employers == null ? new ArrayList<>() : employers;
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

    public static class Render {
        private int timeoutSeconds = 30;
        private int retryTimeoutSeconds = 60;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getRetryTimeoutSeconds() {
            return Math.max(getTimeoutSeconds(), retryTimeoutSeconds);
        }

        public void setRetryTimeoutSeconds(int retryTimeoutSeconds) {
            this.retryTimeoutSeconds = Math.max(1, retryTimeoutSeconds);
        }
    }

    public static class Extraction {
        private int maxJobPages = 200;
        private int minAboutJobLength = 200;
        private int maxContentChars = 4000;

        public int getMaxJobPages() {
            return Math.max(1, maxJobPages);
        }

        public void setMaxJobPages(int maxJobPages) {
            this.maxJobPages = Math.max(1, maxJobPages);
        }

        public int getMinAboutJobLength() {
            return Math.max(0, minAboutJobLength);
        }

        public void setMinAboutJobLength(int minAboutJobLength) {
            this.minAboutJobLength = Math.max(0, minAboutJobLength);
        }

        public int getMaxContentChars() {
            return Math.max(500, maxContentChars);
        }

        public void setMaxContentChars(int maxContentChars) {
            this.maxContentChars = maxContentChars;
        }
    }

    public static class Ai {
        private boolean enabled = false;
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKey = "";
        private String model = "gpt-3.5-turbo";
        private double temperature = 0.1;
        private int maxTokens = 1500;
        private double costPerThousandTokens = 0.002;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public double getCostPerThousandTokens() {
            return Math.max(0.0, costPerThousandTokens);
        }

        public void setCostPerThousandTokens(double costPerThousandTokens) {
            this.costPerThousandTokens = costPerThousandTokens;
        }

        public boolean isConfigured() {
            return enabled && apiKey != null && !apiKey.isBlank() && endpoint != null && !endpoint.isBlank();
        }
    }

    public static class Submission {
        private boolean enabled = false;
        private String baseUrl = "";
        private String apiKey = "";
        private String source = "Board Sync Scraper";
        private int batchSize = 25;
        private int maxAttempts = 3;
        private int retryBaseDelayMs = 1000;
        private int timeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

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

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Run {
        private int employerBatchSize = 10;
        private boolean resume = true;
        private String progressFile = "data/run-progress.json";

        public int getEmployerBatchSize() {
            return Math.max(1, employerBatchSize);
        }

        public void setEmployerBatchSize(int employerBatchSize) {
            this.employerBatchSize = Math.max(1, employerBatchSize);
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }

        public String getProgressFile() {
            return progressFile;
        }

        public void setProgressFile(String progressFile) {
            this.progressFile = progressFile;
        }
    }

    public static class Data {
        private String employersCsv = "";

        public String getEmployersCsv() {
            return employersCsv;
        }

        public void setEmployersCsv(String employersCsv) {
            this.employersCsv = employersCsv;
        }
    }

    public static class Employer {
        private String name;
        private List<String> listingUrls = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getListingUrls() {
            return listingUrls;
        }

        public void setListingUrls(List<String> listingUrls) {
            this.listingUrls = listingUrls == null ? new ArrayList<>() : listingUrls;
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
}
