package com.sifinder.search;

import java.util.Comparator;

public record Match(int distance, String path) {
    public static final Comparator<Match> BY_DISTANCE_THEN_PATH = Comparator
            .comparingInt(Match::distance)
            .thenComparing(Match::path);
}
