package com.sifinder.service;

import java.nio.file.Path;
import java.util.List;

import com.sifinder.search.Match;

public record SearchCompletedEvent(String slot, long generation, String indexName, Path queryImage, List<Match> matches)
        implements WorkerEvent {

    public SearchCompletedEvent {
        matches = List.copyOf(matches);
    }
}
