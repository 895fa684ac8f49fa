package com.sifinder.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private String dataDir;
    private IndexingConfig indexing = new IndexingConfig();
    private SearchConfig search = new SearchConfig();
    private WorkersConfig workers = new WorkersConfig();
    private LinksConfig links = new LinksConfig();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public WorkersConfig getWorkers() {
        return workers;
    }

    public void setWorkers(WorkersConfig workers) {
        this.workers = workers == null ? new WorkersConfig() : workers;
    }

    public LinksConfig getLinks() {
        return links;
    }

    public void setLinks(LinksConfig links) {
        this.links = links == null ? new LinksConfig() : links;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private int progressInterval = 10;
        private List<String> supportedExtensions = new ArrayList<>(List.of("png", "jpg", "jpeg", "webp"));

        public int getProgressInterval() {
            return progressInterval;
        }

        public void setProgressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
        }

        public List<String> getSupportedExtensions() {
            return supportedExtensions;
        }

        public void setSupportedExtensions(List<String> supportedExtensions) {
            this.supportedExtensions = supportedExtensions == null ? new ArrayList<>() : supportedExtensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int defaultThreshold = 8;
        private int maxThreshold = 64;

        public int getDefaultThreshold() {
            return defaultThreshold;
        }

        public void setDefaultThreshold(int defaultThreshold) {
            this.defaultThreshold = defaultThreshold;
        }

        public int getMaxThreshold() {
            return maxThreshold;
        }

        public void setMaxThreshold(int maxThreshold) {
            this.maxThreshold = maxThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkersConfig {
        private int poolSize = 2;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LinksConfig {
        private String baseUrl = "https://your-website.com/search?id=";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
