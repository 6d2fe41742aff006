package com.embedbot.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ControlDbConfig controlDb = new ControlDbConfig();
    private StorageConfig storage = new StorageConfig();
    private EncryptionConfig encryption = new EncryptionConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private SegmenterConfig segmenter = new SegmenterConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private StoreConfig store = new StoreConfig();
    private FallbackConfig fallback = new FallbackConfig();

    public ControlDbConfig getControlDb() {
        return controlDb;
    }

    public void setControlDb(ControlDbConfig controlDb) {
        this.controlDb = controlDb == null ? new ControlDbConfig() : controlDb;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public EncryptionConfig getEncryption() {
        return encryption;
    }

    public void setEncryption(EncryptionConfig encryption) {
        this.encryption = encryption == null ? new EncryptionConfig() : encryption;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public SegmenterConfig getSegmenter() {
        return segmenter;
    }

    public void setSegmenter(SegmenterConfig segmenter) {
        this.segmenter = segmenter == null ? new SegmenterConfig() : segmenter;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public FallbackConfig getFallback() {
        return fallback;
    }

    public void setFallback(FallbackConfig fallback) {
        this.fallback = fallback == null ? new FallbackConfig() : fallback;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ControlDbConfig {
        private String url = "jdbc:postgresql://localhost:5432/embedbot";
        private String user = "embedbot";
        private String password = "";
        private int poolSize = 4;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String uploadsDir = ".embedbot/uploads";

        public String getUploadsDir() {
            return uploadsDir;
        }

        public void setUploadsDir(String uploadsDir) {
            this.uploadsDir = uploadsDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EncryptionConfig {
        /** Base64 encoded AES key (16, 24 or 32 bytes). */
        private String key;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "text-embedding-3-small";
        private int dimensions = 1536;
        private int batchSize = 10;
        private int maxAttempts = 6;
        private long retryBaseDelayMs = 4000;
        private long retryMaxDelayMs = 60000;
        private long requestDelayMs = 2000;
        private long callTimeoutMs = 60000;

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

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public long getRequestDelayMs() {
            return requestDelayMs;
        }

        public void setRequestDelayMs(long requestDelayMs) {
            this.requestDelayMs = requestDelayMs;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SegmenterConfig {
        private int maxSentences = 3;
        private int maxCharacters = 1000;
        private int minWords = 3;
        private double minAlphaRatio = 0.5;
        private String language = "en";

        public int getMaxSentences() {
            return maxSentences;
        }

        public void setMaxSentences(int maxSentences) {
            this.maxSentences = maxSentences;
        }

        public int getMaxCharacters() {
            return maxCharacters;
        }

        public void setMaxCharacters(int maxCharacters) {
            this.maxCharacters = maxCharacters;
        }

        public int getMinWords() {
            return minWords;
        }

        public void setMinWords(int minWords) {
            this.minWords = minWords;
        }

        public double getMinAlphaRatio() {
            return minAlphaRatio;
        }

        public void setMinAlphaRatio(double minAlphaRatio) {
            this.minAlphaRatio = minAlphaRatio;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int workers = 4;
        private int maxUploadMb = 15;
        private List<String> allowedExtensions = List.of(".docx", ".txt", ".md", ".csv");
        private int historySize = 10;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getMaxUploadMb() {
            return maxUploadMb;
        }

        public void setMaxUploadMb(int maxUploadMb) {
            this.maxUploadMb = maxUploadMb;
        }

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions == null ? List.of(".docx", ".txt", ".md", ".csv") : allowedExtensions;
        }

        public int getHistorySize() {
            return historySize;
        }

        public void setHistorySize(int historySize) {
            this.historySize = historySize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private int poolSize = 2;
        private int probeTimeoutSeconds = 5;
        private String sslMode = "require";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getProbeTimeoutSeconds() {
            return probeTimeoutSeconds;
        }

        public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
            this.probeTimeoutSeconds = probeTimeoutSeconds;
        }

        public String getSslMode() {
            return sslMode;
        }

        public void setSslMode(String sslMode) {
            this.sslMode = sslMode;
        }
    }

    /**
     * Shared store and provider credentials used for tenants that have not finished onboarding.
     * Disabled unless both a store host and a provider key are set.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FallbackConfig {
        private String storeHost;
        private int storePort = 5432;
        private String storeDatabase;
        private String storeUser;
        private String storePassword;
        private String providerApiKey;

        public boolean isEnabled() {
            return storeHost != null && !storeHost.isBlank()
                    && providerApiKey != null && !providerApiKey.isBlank();
        }

        public String getStoreHost() {
            return storeHost;
        }

        public void setStoreHost(String storeHost) {
            this.storeHost = storeHost;
        }

        public int getStorePort() {
            return storePort;
        }

        public void setStorePort(int storePort) {
            this.storePort = storePort;
        }

        public String getStoreDatabase() {
            return storeDatabase;
        }

        public void setStoreDatabase(String storeDatabase) {
            this.storeDatabase = storeDatabase;
        }

        public String getStoreUser() {
            return storeUser;
        }

        public void setStoreUser(String storeUser) {
            this.storeUser = storeUser;
        }

        public String getStorePassword() {
            return storePassword;
        }

        public void setStorePassword(String storePassword) {
            this.storePassword = storePassword;
        }

        public String getProviderApiKey() {
            return providerApiKey;
        }

        public void setProviderApiKey(String providerApiKey) {
            this.providerApiKey = providerApiKey;
        }
    }
}
