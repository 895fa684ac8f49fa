package com.sifinder.service;

import com.sifinder.ingest.IndexProgress;

public record IndexProgressEvent(String slot, long generation, String indexName, IndexProgress progress)
        implements WorkerEvent {
}
