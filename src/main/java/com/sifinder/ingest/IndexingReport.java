package com.sifinder.ingest;

import java.util.List;

public record IndexingReport(
        String indexName,
        String sourcePath,
        int totalFiles,
        int hashedFiles,
        int unchangedFiles,
        List<String> failedFiles) {

    public IndexingReport {
        failedFiles = List.copyOf(failedFiles);
    }

    public int failedCount() {
        return failedFiles.size();
    }
}
