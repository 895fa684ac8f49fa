package com.sifinder.search;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sifinder.fingerprint.DecodeException;
import com.sifinder.fingerprint.Fingerprint;
import com.sifinder.fingerprint.FingerprintExtractor;
import com.sifinder.store.ImageRecord;
import com.sifinder.store.IndexStore;

/**
 * Linear Hamming-distance scan over a store. Records whose file has disappeared stay stored but
 * never show up in results.
 */
public class SimilaritySearchEngine {
    private static final Logger log = LoggerFactory.getLogger(SimilaritySearchEngine.class);

    private final FingerprintExtractor extractor;
    private final Predicate<String> fileExists;

    public SimilaritySearchEngine(FingerprintExtractor extractor) {
        this(extractor, SimilaritySearchEngine::existsOnDisk);
    }

    SimilaritySearchEngine(FingerprintExtractor extractor, Predicate<String> fileExists) {
        this.extractor = extractor;
        this.fileExists = fileExists;
    }

    public List<Match> search(IndexStore store, Path queryImage, int threshold) throws DecodeException {
        validateThreshold(threshold);
        Fingerprint query = extractor.compute(queryImage);
        log.debug("search.query path={} fingerprint={}", queryImage, query);
        return search(store, query, threshold);
    }

    public List<Match> search(IndexStore store, Fingerprint query, int threshold) {
        validateThreshold(threshold);
        List<Match> matches = new ArrayList<>();
        int scanned = 0;
        int missing = 0;
        try (Stream<ImageRecord> records = store.scanAll()) {
            for (ImageRecord record : (Iterable<ImageRecord>) records::iterator) {
                scanned++;
                int distance = query.distanceTo(record.fingerprint());
                if (distance > threshold) {
                    continue;
                }
                if (fileExists.test(record.path())) {
                    matches.add(new Match(distance, record.path()));
                } else {
                    missing++;
                }
            }
        }
        matches.sort(Match.BY_DISTANCE_THEN_PATH);
        log.info("search.complete index={} threshold={} scanned={} missing={} matches={}",
                store.name(), threshold, scanned, missing, matches.size());
        return matches;
    }

    public static void validateThreshold(int threshold) {
        if (threshold < 0 || threshold > Fingerprint.BITS) {
            throw new IllegalArgumentException("threshold must be between 0 and " + Fingerprint.BITS + " but was " + threshold);
        }
    }

    private static boolean existsOnDisk(String path) {
        try {
            return Files.exists(Path.of(path));
        } catch (InvalidPathException e) {
            log.debug("search.record.invalid-path path={}", path);
            return false;
        }
    }
}
