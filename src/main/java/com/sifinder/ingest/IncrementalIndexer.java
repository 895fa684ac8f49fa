package com.sifinder.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sifinder.fingerprint.DecodeException;
import com.sifinder.fingerprint.Fingerprint;
import com.sifinder.fingerprint.FingerprintExtractor;
import com.sifinder.store.IndexStore;

/**
 * Brings a store up to date with the images directly inside a directory. Files whose modification
 * time matches the stored one are never decoded again.
 */
public class IncrementalIndexer {
    private static final Logger log = LoggerFactory.getLogger(IncrementalIndexer.class);

    private final FingerprintExtractor extractor;
    private final SupportedFormats formats;
    private final int progressInterval;

    public IncrementalIndexer(FingerprintExtractor extractor) {
        this(extractor, SupportedFormats.defaults(), 10);
    }

    public IncrementalIndexer(FingerprintExtractor extractor, SupportedFormats formats, int progressInterval) {
        this.extractor = extractor;
        this.formats = formats;
        this.progressInterval = Math.max(1, progressInterval);
    }

    public IndexingReport index(IndexStore store, Path directory, ProgressListener listener) throws IOException {
        Path root = directory.toAbsolutePath().normalize();
        List<Path> files = listCandidates(root);
        int total = files.size();
        log.info("index.start name={} directory={} candidates={}", store.name(), root, total);

        int hashed = 0;
        int unchanged = 0;
        List<String> failed = new ArrayList<>();

        for (int i = 0; i < total; i++) {
            Path file = files.get(i);
            String key = file.toString();
            try {
                long modifiedTime = modifiedTime(file);
                OptionalLong stored = store.modifiedTime(key);
                if (stored.isPresent() && stored.getAsLong() == modifiedTime) {
                    unchanged++;
                } else {
                    Fingerprint fingerprint = extractor.compute(file);
                    store.upsert(key, fingerprint, modifiedTime);
                    hashed++;
                }
            } catch (DecodeException e) {
                failed.add(key);
                log.warn("index.file.skipped path={} reason={}", key, e.getMessage());
            } catch (IOException e) {
                failed.add(key);
                log.warn("index.file.unreadable path={} reason={}", key, e.getMessage());
            }

            int processed = i + 1;
            if (processed % progressInterval == 0 && processed < total) {
                listener.onProgress(new IndexProgress(processed, total));
            }
        }
        listener.onProgress(new IndexProgress(total, total));

        store.setMeta(IndexStore.SOURCE_PATH_KEY, root.toString());
        log.info("index.complete name={} total={} hashed={} unchanged={} failed={}",
                store.name(), total, hashed, unchanged, failed.size());
        return new IndexingReport(store.name(), root.toString(), total, hashed, unchanged, failed);
    }

    List<Path> listCandidates(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString(), null, "directory to index does not exist");
        }
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(formats::supports)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    static long modifiedTime(Path file) throws IOException {
        return Files.getLastModifiedTime(file).to(TimeUnit.MICROSECONDS);
    }
}
