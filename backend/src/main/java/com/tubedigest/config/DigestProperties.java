package com.tubedigest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "digest")
public class DigestProperties {
    private static final String DEFAULT_USER_AGENT = "tube-digest/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int staleRunMinutes = 60;
    private Run run = new Run();
    private Governor governor = new Governor();
    private YouTube youtube = new YouTube();
    private Summarizer summarizer = new Summarizer();
    private Scheduler scheduler = new Scheduler();
    private Cli cli = new Cli();
    private Output output = new Output();

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

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = staleRunMinutes;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Governor getGovernor() {
        return governor;
    }

    public void setGovernor(Governor governor) {
        this.governor = governor;
    }

    public YouTube getYoutube() {
        return youtube;
    }

    public void setYoutube(YouTube youtube) {
        this.youtube = youtube;
    }

    public Summarizer getSummarizer() {
        return summarizer;
    }

    public void setSummarizer(Summarizer summarizer) {
        this.summarizer = summarizer;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Run {
        private int defaultQuota = 5;
        private int summarizeMaxRetries = 3;
        private int maxSummaryLines = 6;
        private int initialLookbackHours = 24;

        public int getDefaultQuota() {
            return Math.max(0, defaultQuota);
        }

        public void setDefaultQuota(int defaultQuota) {
            this.defaultQuota = defaultQuota;
        }

        public int getSummarizeMaxRetries() {
            return Math.max(0, summarizeMaxRetries);
        }

        public void setSummarizeMaxRetries(int summarizeMaxRetries) {
            this.summarizeMaxRetries = summarizeMaxRetries;
        }

        public int getMaxSummaryLines() {
            return Math.max(1, maxSummaryLines);
        }

        public void setMaxSummaryLines(int maxSummaryLines) {
            this.maxSummaryLines = maxSummaryLines;
        }

        public int getInitialLookbackHours() {
            return Math.max(0, initialLookbackHours);
        }

        public void setInitialLookbackHours(int initialLookbackHours) {
            this.initialLookbackHours = initialLookbackHours;
        }
    }

    public static class Governor {
        private Window discovery = new Window(500, 1500);
        private Window transcript = new Window(3000, 7000);
        private Window summarize = new Window(1000, 3000);
        private long backoffBaseMs = 2000;
        private long backoffCapMs = 120_000;

        public Window getDiscovery() {
            return discovery;
        }

        public void setDiscovery(Window discovery) {
            this.discovery = discovery;
        }

        public Window getTranscript() {
            return transcript;
        }

        public void setTranscript(Window transcript) {
            this.transcript = transcript;
        }

        public Window getSummarize() {
            return summarize;
        }

        public void setSummarize(Window summarize) {
            this.summarize = summarize;
        }

        public long getBackoffBaseMs() {
            return Math.max(0, backoffBaseMs);
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
        }

        public long getBackoffCapMs() {
            return Math.max(getBackoffBaseMs(), backoffCapMs);
        }

        public void setBackoffCapMs(long backoffCapMs) {
            this.backoffCapMs = backoffCapMs;
        }
    }

    public static class Window {
        private long minDelayMs;
        private long maxDelayMs;

        public Window() {
        }

        public Window(long minDelayMs, long maxDelayMs) {
            this.minDelayMs = minDelayMs;
            this.maxDelayMs = maxDelayMs;
        }

        public long getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(long minDelayMs) {
            this.minDelayMs = minDelayMs;
        }

        public long getMaxDelayMs() {
            return Math.max(getMinDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class YouTube {
        private String feedBaseUrl = "https://www.youtube.com/feeds/videos.xml";
        private String channelPageBaseUrl = "https://www.youtube.com";
        private String transcriptBaseUrl = "https://www.youtube.com/api/timedtext";
        private List<String> transcriptLanguages = new ArrayList<>(List.of("en"));

        public String getFeedBaseUrl() {
            return feedBaseUrl;
        }

        public void setFeedBaseUrl(String feedBaseUrl) {
            this.feedBaseUrl = feedBaseUrl;
        }

        public String getChannelPageBaseUrl() {
            return channelPageBaseUrl;
        }

        public void setChannelPageBaseUrl(String channelPageBaseUrl) {
            this.channelPageBaseUrl = channelPageBaseUrl;
        }

        public String getTranscriptBaseUrl() {
            return transcriptBaseUrl;
        }

        public void setTranscriptBaseUrl(String transcriptBaseUrl) {
            this.transcriptBaseUrl = transcriptBaseUrl;
        }

        public List<String> getTranscriptLanguages() {
            if (transcriptLanguages == null || transcriptLanguages.isEmpty()) {
                return List.of("en");
            }
            return transcriptLanguages;
        }

        public void setTranscriptLanguages(List<String> transcriptLanguages) {
            this.transcriptLanguages = transcriptLanguages;
        }
    }

    public static class Summarizer {
        private String provider = "ollama";
        private int maxTokens = 512;
        private double temperature = 0.7;
        private Provider groq = new Provider("https://api.groq.com/openai/v1", "llama-3.3-70b-versatile");
        private Provider ollama = new Provider("http://localhost:11434/v1", "gemma3:4b");

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public int getMaxTokens() {
            return Math.max(16, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Provider getGroq() {
            return groq;
        }

        public void setGroq(Provider groq) {
            this.groq = groq;
        }

        public Provider getOllama() {
            return ollama;
        }

        public void setOllama(Provider ollama) {
            this.ollama = ollama;
        }
    }

    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private String model;

        public Provider() {
        }

        public Provider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
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

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private int intervalMinutes = 60;
        private int initialDelaySeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalMinutes() {
            return Math.max(1, intervalMinutes);
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
        }

        public int getInitialDelaySeconds() {
            return Math.max(0, initialDelaySeconds);
        }

        public void setInitialDelaySeconds(int initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
        }
    }

    public static class Cli {
        private boolean run = false;
        private Integer quota;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public Integer getQuota() {
            return quota;
        }

        public void setQuota(Integer quota) {
            this.quota = quota;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Output {
        private boolean enabled = true;
        private String path = "daily_digest.json";

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
