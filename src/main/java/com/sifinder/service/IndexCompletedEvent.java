package com.sifinder.service;

import com.sifinder.ingest.IndexingReport;

public record IndexCompletedEvent(String slot, long generation, IndexingReport report) implements WorkerEvent {
}
