package com.wikigen.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public static final String DATA_DIR_ENV = "WIKIGEN_DATA_DIR";

    private IndexConfig index = new IndexConfig();
    private SearchConfig search = new SearchConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public Path dataDir() {
        String override = System.getenv(DATA_DIR_ENV);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        String configured = index.getDataDir();
        if (configured.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(configured.substring(2));
        }
        return Path.of(configured);
    }

    public Path databasePath() {
        return dataDir().resolve(index.getDatabaseFile());
    }

    public Path vectorIndexPath() {
        return dataDir().resolve(index.getVectorIndexFile());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String dataDir = "~/.wikigen";
        private String databaseFile = "file_index.db";
        private String vectorIndexFile = "vector_index.bin";
        private String pattern = "*.md";
        private boolean excludeHidden = true;
        private long maxFileSize = 100_000;
        private List<String> excludePatterns = new ArrayList<>(List.of(
                "**/node_modules/**",
                "**/venv/**",
                "**/.venv/**",
                "**/dist/**",
                "**/build/**"));

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getDatabaseFile() {
            return databaseFile;
        }

        public void setDatabaseFile(String databaseFile) {
            this.databaseFile = databaseFile;
        }

        public String getVectorIndexFile() {
            return vectorIndexFile;
        }

        public void setVectorIndexFile(String vectorIndexFile) {
            this.vectorIndexFile = vectorIndexFile;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public boolean isExcludeHidden() {
            return excludeHidden;
        }

        public void setExcludeHidden(boolean excludeHidden) {
            this.excludeHidden = excludeHidden;
        }

        public long getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
        }

        public List<String> getExcludePatterns() {
            return excludePatterns;
        }

        public void setExcludePatterns(List<String> excludePatterns) {
            this.excludePatterns = excludePatterns == null ? new ArrayList<>() : excludePatterns;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private boolean semanticSearchEnabled = true;
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private int maxChunksPerFile = 5;
        private int candidateLimit = 50;
        private int defaultLimit = 10;

        public boolean isSemanticSearchEnabled() {
            return semanticSearchEnabled;
        }

        public void setSemanticSearchEnabled(boolean semanticSearchEnabled) {
            this.semanticSearchEnabled = semanticSearchEnabled;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getMaxChunksPerFile() {
            return maxChunksPerFile;
        }

        public void setMaxChunksPerFile(int maxChunksPerFile) {
            this.maxChunksPerFile = maxChunksPerFile;
        }

        public int getCandidateLimit() {
            return candidateLimit;
        }

        public void setCandidateLimit(int candidateLimit) {
            this.candidateLimit = candidateLimit;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "local";
        private String model = "hashing-v1";
        private int dimension = 384;
        private String endpoint;
        private String apiKeyEnv = "WIKIGEN_EMBEDDING_API_KEY";
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
