package com.cmagents.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cmagents")
public class CampaignAgentsProperties {

    private int workerConcurrency = 16;
    private String apiKey;
    private AiProvider aiProvider = AiProvider.NONE;
    private OpenAIConfig openai = new OpenAIConfig();
    private PlanningConfig planning = new PlanningConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private SessionConfig sessions = new SessionConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private IntentConfig intent = new IntentConfig();
    private ArtifactConfig artifacts = new ArtifactConfig();
    private BrandConfig brands = new BrandConfig();

    public enum AiProvider {
        NONE, GOOGLE, OPENAI
    }

    public static class OpenAIConfig {
        private String model = "gpt-4o-mini";

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class PlanningConfig {
        private boolean delegateEnabled = true;
        private Duration delegateTimeout = Duration.ofSeconds(20);

        public boolean isDelegateEnabled() { return delegateEnabled; }
        public void setDelegateEnabled(boolean delegateEnabled) { this.delegateEnabled = delegateEnabled; }
        public Duration getDelegateTimeout() { return delegateTimeout; }
        public void setDelegateTimeout(Duration delegateTimeout) {
            this.delegateTimeout = delegateTimeout != null ? delegateTimeout : Duration.ofSeconds(20);
        }
    }

    public static class ExecutionConfig {
        private Duration workerTimeout = Duration.ofSeconds(90);
        private int transientRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(250);
        private int defaultMaxRetries = 1;

        public Duration getWorkerTimeout() { return workerTimeout; }
        public void setWorkerTimeout(Duration workerTimeout) {
            this.workerTimeout = workerTimeout != null ? workerTimeout : Duration.ofSeconds(90);
        }
        public int getTransientRetries() { return transientRetries; }
        public void setTransientRetries(int transientRetries) { this.transientRetries = Math.max(0, transientRetries); }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff != null ? retryBackoff : Duration.ZERO;
        }
        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = Math.max(0, defaultMaxRetries); }
    }

    public static class SessionConfig {
        private int capacity = 500;
        private int historyLimit = 80;
        private int maxConnectionsPerSession = 8;
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration connectionTimeout = Duration.ofSeconds(90);
        private Duration idleGrace = Duration.ofMinutes(5);

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
        public int getMaxConnectionsPerSession() { return maxConnectionsPerSession; }
        public void setMaxConnectionsPerSession(int maxConnectionsPerSession) {
            this.maxConnectionsPerSession = maxConnectionsPerSession;
        }
        public Duration getPingInterval() { return pingInterval; }
        public void setPingInterval(Duration pingInterval) { this.pingInterval = pingInterval; }
        public Duration getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
        public Duration getIdleGrace() { return idleGrace; }
        public void setIdleGrace(Duration idleGrace) { this.idleGrace = idleGrace; }
    }

    public static class RateLimitConfig {
        private int requestsPerMinute = 120;
        private int messagesPerMinute = 30;
        private Duration window = Duration.ofMinutes(1);
        private boolean trustForwardedHeader = false;
        private Duration purgeInterval = Duration.ofMinutes(5);

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }
        public int getMessagesPerMinute() { return messagesPerMinute; }
        public void setMessagesPerMinute(int messagesPerMinute) { this.messagesPerMinute = messagesPerMinute; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window != null ? window : Duration.ofMinutes(1); }
        public boolean isTrustForwardedHeader() { return trustForwardedHeader; }
        public void setTrustForwardedHeader(boolean trustForwardedHeader) { this.trustForwardedHeader = trustForwardedHeader; }
        public Duration getPurgeInterval() { return purgeInterval; }
        public void setPurgeInterval(Duration purgeInterval) { this.purgeInterval = purgeInterval; }
    }

    public static class IntentConfig {
        private List<String> noTextPhrases = new ArrayList<>(List.of(
                "sin texto", "no text", "sin copy", "sin headline", "sin titulares",
                "solo producto", "solo la foto", "sin tipografia"));
        private List<String> trendPhrases = new ArrayList<>(List.of(
                "tendencia", "trends", "inspiracion", "que esta funcionando", "referencias"));
        private List<String> buildConfirmations = new ArrayList<>(List.of(
                "/build", "ok", "dale", "aprobado", "apruebo", "si", "genera", "ejecuta", "adelante"));

        public List<String> getNoTextPhrases() { return noTextPhrases; }
        public void setNoTextPhrases(List<String> noTextPhrases) {
            this.noTextPhrases = noTextPhrases != null ? new ArrayList<>(noTextPhrases) : new ArrayList<>();
        }
        public List<String> getTrendPhrases() { return trendPhrases; }
        public void setTrendPhrases(List<String> trendPhrases) {
            this.trendPhrases = trendPhrases != null ? new ArrayList<>(trendPhrases) : new ArrayList<>();
        }
        public List<String> getBuildConfirmations() { return buildConfirmations; }
        public void setBuildConfirmations(List<String> buildConfirmations) {
            this.buildConfirmations = buildConfirmations != null ? new ArrayList<>(buildConfirmations) : new ArrayList<>();
        }
    }

    public static class ArtifactConfig {
        private String outputDir = "outputs/agent_runs";

        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    }

    public static class BrandConfig {
        private String root = "brands";
        private String defaultBrand;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getDefaultBrand() { return defaultBrand; }
        public void setDefaultBrand(String defaultBrand) { this.defaultBrand = defaultBrand; }
    }

    /**
     * Shared key expected in the {@code X-API-Key} header. REST calls are open when unset.
     */
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider != null ? aiProvider : AiProvider.NONE;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai != null ? openai : new OpenAIConfig();
    }

    public PlanningConfig getPlanning() {
        return planning;
    }

    public void setPlanning(PlanningConfig planning) {
        this.planning = planning != null ? planning : new PlanningConfig();
    }

    public ExecutionConfig getExecution() {
        return execution;
    }

    public void setExecution(ExecutionConfig execution) {
        this.execution = execution != null ? execution : new ExecutionConfig();
    }

    public SessionConfig getSessions() {
        return sessions;
    }

    public void setSessions(SessionConfig sessions) {
        this.sessions = sessions != null ? sessions : new SessionConfig();
    }

    public RateLimitConfig getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit != null ? rateLimit : new RateLimitConfig();
    }

    public IntentConfig getIntent() {
        return intent;
    }

    public void setIntent(IntentConfig intent) {
        this.intent = intent != null ? intent : new IntentConfig();
    }

    public ArtifactConfig getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(ArtifactConfig artifacts) {
        this.artifacts = artifacts != null ? artifacts : new ArtifactConfig();
    }

    public BrandConfig getBrands() {
        return brands;
    }

    public void setBrands(BrandConfig brands) {
        this.brands = brands != null ? brands : new BrandConfig();
    }
}
