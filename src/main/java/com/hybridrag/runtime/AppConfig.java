package com.hybridrag.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private LexicalConfig lexical = new LexicalConfig();
    private VectorConfig vector = new VectorConfig();
    private SearchConfig search = new SearchConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public LexicalConfig getLexical() {
        return lexical;
    }

    public void setLexical(LexicalConfig lexical) {
        this.lexical = lexical == null ? new LexicalConfig() : lexical;
    }

    public VectorConfig getVector() {
        return vector;
    }

    public void setVector(VectorConfig vector) {
        this.vector = vector == null ? new VectorConfig() : vector;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String snapshotPath = ".hybridrag/corpus.json";

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LexicalConfig {
        private String analyzer = "standard";
        private double bm25K1 = 1.2;
        private double bm25B = 0.75;

        public String getAnalyzer() {
            return analyzer;
        }

        public void setAnalyzer(String analyzer) {
            this.analyzer = analyzer == null ? "standard" : analyzer;
        }

        public double getBm25K1() {
            return bm25K1;
        }

        public void setBm25K1(double bm25K1) {
            this.bm25K1 = bm25K1;
        }

        public double getBm25B() {
            return bm25B;
        }

        public void setBm25B(double bm25B) {
            this.bm25B = bm25B;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorConfig {
        private int exhaustiveScanThreshold = 150;
        private int minCandidateFactor = 5;

        public int getExhaustiveScanThreshold() {
            return exhaustiveScanThreshold;
        }

        public void setExhaustiveScanThreshold(int exhaustiveScanThreshold) {
            this.exhaustiveScanThreshold = exhaustiveScanThreshold;
        }

        public int getMinCandidateFactor() {
            return minCandidateFactor;
        }

        public void setMinCandidateFactor(int minCandidateFactor) {
            this.minCandidateFactor = minCandidateFactor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int timeoutMs = 30000;
        private int threads = 4;
        private double defaultTextWeight = 0.5;
        private double defaultVectorWeight = 0.5;
        private int defaultLimit = 10;
        private int candidateMultiplier = 4;

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public double getDefaultTextWeight() {
            return defaultTextWeight;
        }

        public void setDefaultTextWeight(double defaultTextWeight) {
            this.defaultTextWeight = defaultTextWeight;
        }

        public double getDefaultVectorWeight() {
            return defaultVectorWeight;
        }

        public void setDefaultVectorWeight(double defaultVectorWeight) {
            this.defaultVectorWeight = defaultVectorWeight;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getCandidateMultiplier() {
            return candidateMultiplier;
        }

        public void setCandidateMultiplier(int candidateMultiplier) {
            this.candidateMultiplier = candidateMultiplier;
        }
    }
}
