package com.sifinder.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sifinder.fingerprint.DecodeException;
import com.sifinder.fingerprint.FingerprintExtractor;
import com.sifinder.fingerprint.PerceptualHashExtractor;
import com.sifinder.ingest.IncrementalIndexer;
import com.sifinder.ingest.IndexingReport;
import com.sifinder.ingest.ProgressListener;
import com.sifinder.ingest.SupportedFormats;
import com.sifinder.runtime.AppConfig;
import com.sifinder.search.Match;
import com.sifinder.search.SimilaritySearchEngine;
import com.sifinder.store.ImageRecord;
import com.sifinder.store.IndexCatalog;
import com.sifinder.store.IndexNames;
import com.sifinder.store.IndexStore;
import com.sifinder.store.IndexSummary;
import com.sifinder.store.SqliteIndexStore;
import com.sifinder.store.StoreException;

/**
 * Operations offered to a front end: create, index, search, list, delete and prune indexes.
 */
public class ImageFinder {
    private static final Logger log = LoggerFactory.getLogger(ImageFinder.class);

    private final IndexCatalog catalog;
    private final IncrementalIndexer indexer;
    private final SimilaritySearchEngine searchEngine;

    public ImageFinder(IndexCatalog catalog, IncrementalIndexer indexer, SimilaritySearchEngine searchEngine) {
        this.catalog = catalog;
        this.indexer = indexer;
        this.searchEngine = searchEngine;
    }

    public static ImageFinder create(Path dataDir, AppConfig config) {
        return create(dataDir, config, new PerceptualHashExtractor());
    }

    public static ImageFinder create(Path dataDir, AppConfig config, FingerprintExtractor extractor) {
        SupportedFormats formats = new SupportedFormats(config.getIndexing().getSupportedExtensions());
        return new ImageFinder(
                new IndexCatalog(dataDir),
                new IncrementalIndexer(extractor, formats, config.getIndexing().getProgressInterval()),
                new SimilaritySearchEngine(extractor));
    }

    public IndexCatalog catalog() {
        return catalog;
    }

    public IndexHandle createOrOpenIndex(Path directory) throws IOException {
        Path source = directory.toAbsolutePath().normalize();
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString(), null, "directory to index does not exist");
        }
        if (!Files.isDirectory(source)) {
            throw new NotDirectoryException(source.toString());
        }
        String name = IndexNames.forDirectory(source);
        try (SqliteIndexStore store = catalog.openOrCreate(name)) {
            if (store.meta(IndexStore.SOURCE_PATH_KEY).isEmpty()) {
                store.setMeta(IndexStore.SOURCE_PATH_KEY, source.toString());
            }
            return new IndexHandle(name, source, store.databasePath());
        }
    }

    public IndexHandle openIndex(String name) {
        try (SqliteIndexStore store = catalog.openExisting(name)) {
            String source = store.meta(IndexStore.SOURCE_PATH_KEY)
                    .filter(value -> !value.isBlank())
                    .orElseThrow(() -> new StoreException("Index " + name + " has no source directory recorded"));
            return new IndexHandle(name, Path.of(source), store.databasePath());
        }
    }

    public IndexingReport runIndex(IndexHandle handle, ProgressListener listener) throws IOException {
        try (IndexCatalog.WriterLease lease = catalog.acquireWriter(handle.name());
                SqliteIndexStore store = catalog.openOrCreate(handle.name())) {
            return indexer.index(store, handle.sourceDirectory(), listener);
        }
    }

    public List<Match> runSearch(IndexHandle handle, Path queryImage, int threshold) throws DecodeException {
        try (SqliteIndexStore store = catalog.openExisting(handle.name())) {
            return searchEngine.search(store, queryImage, threshold);
        }
    }

    public List<IndexSummary> listIndexes() {
        return catalog.list();
    }

    public void deleteIndex(String name) {
        catalog.delete(name);
    }

    /**
     * Removes records whose file no longer exists. Searches already hide such records; this is the
     * explicit cleanup for collections that are not expected to come back online.
     */
    public int pruneMissing(IndexHandle handle) {
        try (IndexCatalog.WriterLease lease = catalog.acquireWriter(handle.name());
                SqliteIndexStore store = catalog.openExisting(handle.name())) {
            List<String> missing = new ArrayList<>();
            try (Stream<ImageRecord> records = store.scanAll()) {
                records.map(ImageRecord::path)
                        .filter(path -> !Files.exists(Path.of(path)))
                        .forEach(missing::add);
            }
            int removed = 0;
            for (String path : missing) {
                if (store.removeRecord(path)) {
                    removed++;
                }
            }
            log.info("index.pruned name={} removed={}", handle.name(), removed);
            return removed;
        }
    }
}
