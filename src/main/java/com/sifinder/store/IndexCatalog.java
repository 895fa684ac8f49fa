package com.sifinder.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of index stores kept in one data directory, one {@code <name>.db} file each. Also
 * serializes writers: at most one indexing pass may hold a store at a time.
 */
public class IndexCatalog {
    private static final Logger log = LoggerFactory.getLogger(IndexCatalog.class);
    static final String EXTENSION = ".db";

    private final Path dataDir;
    private final Set<String> activeWriters = ConcurrentHashMap.newKeySet();

    public IndexCatalog(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path databasePath(String name) {
        return dataDir.resolve(name + EXTENSION);
    }

    public boolean exists(String name) {
        return Files.isRegularFile(databasePath(name));
    }

    public SqliteIndexStore openOrCreate(String name) {
        validateName(name);
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new StoreException("Unable to create data directory " + dataDir, e);
        }
        return SqliteIndexStore.open(name, databasePath(name));
    }

    public SqliteIndexStore openExisting(String name) {
        validateName(name);
        if (!exists(name)) {
            throw new IndexNotFoundException(name);
        }
        return SqliteIndexStore.open(name, databasePath(name));
    }

    public List<IndexSummary> list() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        List<String> names;
        try (Stream<Path> files = Files.list(dataDir)) {
            names = files.filter(Files::isRegularFile)
                    .map(file -> file.getFileName().toString())
                    .filter(fileName -> fileName.endsWith(EXTENSION))
                    .map(fileName -> fileName.substring(0, fileName.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StoreException("Unable to list indexes in " + dataDir, e);
        }

        List<IndexSummary> summaries = new ArrayList<>();
        for (String name : names) {
            summaries.add(new IndexSummary(name, sourcePathOf(name)));
        }
        return summaries;
    }

    public void delete(String name) {
        validateName(name);
        if (!exists(name)) {
            throw new IndexNotFoundException(name);
        }
        try (WriterLease ignored = acquireWriter(name)) {
            Files.deleteIfExists(databasePath(name));
            Files.deleteIfExists(dataDir.resolve(name + EXTENSION + "-wal"));
            Files.deleteIfExists(dataDir.resolve(name + EXTENSION + "-shm"));
            log.info("index.deleted name={}", name);
        } catch (IOException e) {
            throw new StoreException("Unable to delete index " + name, e);
        }
    }

    public WriterLease acquireWriter(String name) {
        if (!activeWriters.add(name)) {
            throw new IndexBusyException(name);
        }
        return new WriterLease(name);
    }

    public boolean isWriting(String name) {
        return activeWriters.contains(name);
    }

    private String sourcePathOf(String name) {
        try {
            return SqliteIndexStore.readMeta(databasePath(name), IndexStore.SOURCE_PATH_KEY).orElse("");
        } catch (StoreException e) {
            log.warn("index.list.unreadable name={} reason={}", name, e.getMessage());
            return "";
        }
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("Invalid index name: " + name);
        }
    }

    public final class WriterLease implements AutoCloseable {
        private final String name;

        private WriterLease(String name) {
            this.name = name;
        }

        public String name() {
            return name;
        }

        @Override
        public void close() {
            activeWriters.remove(name);
        }
    }
}
