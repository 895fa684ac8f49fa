package com.sifinder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sifinder.fingerprint.DecodeException;
import com.sifinder.ingest.IndexingReport;
import com.sifinder.link.MatchLinkBuilder;
import com.sifinder.runtime.AppConfig;
import com.sifinder.runtime.AppConfigLoader;
import com.sifinder.runtime.AppDirectories;
import com.sifinder.search.Match;
import com.sifinder.service.ImageFinder;
import com.sifinder.service.IndexHandle;
import com.sifinder.store.IndexNames;
import com.sifinder.store.IndexNotFoundException;
import com.sifinder.store.IndexSummary;
import com.sifinder.store.StoreException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "si-finder",
        mixinStandardHelpOptions = true,
        version = "si-finder 0.1.0",
        description = "Finds images visually similar to a query image inside an indexed directory.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_INDEX_FAILURE = 3;
    static final int EXIT_SEARCH_FAILURE = 4;
    static final int EXIT_NOT_FOUND = 5;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--data-dir", description = "Directory holding index databases (overrides config)")
    Path dataDir;

    @Option(names = { "-d", "--directory" }, description = "Image directory to index or search")
    Path directory;

    @Option(names = { "-i", "--index" }, description = "Name of an existing index (see --mode list)")
    String indexName;

    @Option(names = { "-q", "--query" }, description = "Query image used in search mode")
    Path query;

    @Option(names = { "-t", "--threshold" }, description = "Maximum Hamming distance for a match, lower is stricter (default from config)")
    Integer threshold;

    @Option(names = "--link-base-url", description = "Base URL for match links (overrides config)")
    String linkBaseUrl;

    @Option(names = "--json", description = "Print results as JSON", defaultValue = "false")
    boolean json;

    private final ObjectMapper objectMapper = new ObjectMapper();
    PrintStream out = System.out;

    enum Mode {
        index,
        search,
        list,
        delete,
        prune
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = new AppConfigLoader().load(Path.of(configPath));
        Path resolvedDataDir = new AppDirectories().resolveDataDir(
                dataDir != null ? dataDir.toString() : config.getDataDir());
        ImageFinder finder = createFinder(resolvedDataDir, config);

        log.info("Starting si-finder in {} mode", mode);
        log.info("Using config file: {} dataDir={}", configPath, resolvedDataDir);

        try {
            return switch (mode) {
                case index -> runIndex(finder);
                case search -> runSearch(finder, config);
                case list -> runList(finder);
                case delete -> runDelete(finder);
                case prune -> runPrune(finder);
            };
        } catch (IndexNotFoundException e) {
            log.error("{}", e.getMessage());
            return EXIT_NOT_FOUND;
        } catch (StoreException e) {
            log.error("Index store failure: {}", e.getMessage(), e);
            return EXIT_INDEX_FAILURE;
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }
    }

    ImageFinder createFinder(Path resolvedDataDir, AppConfig config) {
        return ImageFinder.create(resolvedDataDir, config);
    }

    private int runIndex(ImageFinder finder) throws IOException {
        if (directory == null) {
            log.error("--directory is required in index mode");
            return EXIT_USAGE_ERROR;
        }
        if (!Files.isDirectory(directory)) {
            log.error("Invalid --directory: {} is not a directory", directory.toAbsolutePath().normalize());
            return EXIT_USAGE_ERROR;
        }
        IndexingReport report;
        try {
            IndexHandle handle = finder.createOrOpenIndex(directory);
            report = finder.runIndex(handle, progress -> log.info("Indexing {}/{}", progress.processed(), progress.total()));
        } catch (StoreException | IOException e) {
            log.error("Indexing failed for {}", directory, e);
            return EXIT_INDEX_FAILURE;
        }
        log.info("Indexed directory: index={} total={} hashed={} unchanged={} skipped={}",
                report.indexName(),
                report.totalFiles(),
                report.hashedFiles(),
                report.unchangedFiles(),
                report.failedCount());
        if (json) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } else {
            out.printf("Indexing complete: %s (%d files, %d hashed, %d unchanged, %d skipped)%n",
                    report.indexName(), report.totalFiles(), report.hashedFiles(), report.unchangedFiles(), report.failedCount());
        }
        return EXIT_OK;
    }

    private int runSearch(ImageFinder finder, AppConfig config) throws IOException {
        if (query == null) {
            log.error("--query is required in search mode");
            return EXIT_USAGE_ERROR;
        }
        int effectiveThreshold = threshold != null ? threshold : config.getSearch().getDefaultThreshold();
        int maxThreshold = Math.min(config.getSearch().getMaxThreshold(), 64);
        if (effectiveThreshold < 0 || effectiveThreshold > maxThreshold) {
            log.error("--threshold must be between 0 and {}", maxThreshold);
            return EXIT_USAGE_ERROR;
        }
        IndexHandle handle = resolveHandle(finder);
        if (handle == null) {
            return EXIT_USAGE_ERROR;
        }

        List<Match> matches;
        try {
            matches = finder.runSearch(handle, query, effectiveThreshold);
        } catch (DecodeException e) {
            log.error("Invalid image file: {} ({})", query.getFileName(), e.getMessage());
            return EXIT_SEARCH_FAILURE;
        } catch (StoreException e) {
            log.error("Search failed for index {}", handle.name(), e);
            return EXIT_SEARCH_FAILURE;
        }

        MatchLinkBuilder links = new MatchLinkBuilder(linkBaseUrl != null ? linkBaseUrl : config.getLinks().getBaseUrl());
        log.info("Search complete: index={} threshold={} matches={}", handle.name(), effectiveThreshold, matches.size());
        if (json) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Match match : matches) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("distance", match.distance());
                row.put("path", match.path());
                links.linkFor(match.path()).ifPresent(link -> row.put("link", link));
                rows.add(row);
            }
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows));
        } else {
            out.printf("%d match(es)%n", matches.size());
            for (Match match : matches) {
                String link = links.linkFor(match.path()).map(value -> "  " + value).orElse("");
                out.printf("%3d  %s%s%n", match.distance(), match.path(), link);
            }
        }
        return EXIT_OK;
    }

    private int runList(ImageFinder finder) throws IOException {
        List<IndexSummary> indexes = finder.listIndexes();
        if (json) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(indexes));
            return EXIT_OK;
        }
        if (indexes.isEmpty()) {
            out.println("No indexes found.");
        }
        for (IndexSummary summary : indexes) {
            out.printf("%s  %s%n", summary.name(), summary.sourcePath().isBlank() ? "Unknown path" : summary.sourcePath());
        }
        return EXIT_OK;
    }

    private int runDelete(ImageFinder finder) {
        String name = indexName != null ? indexName : directory != null ? IndexNames.forDirectory(directory) : null;
        if (name == null) {
            log.error("--index or --directory is required in delete mode");
            return EXIT_USAGE_ERROR;
        }
        try {
            finder.deleteIndex(name);
        } catch (StoreException e) {
            log.error("Unable to delete index {}", name, e);
            return EXIT_INDEX_FAILURE;
        }
        out.printf("Deleted index %s%n", name);
        return EXIT_OK;
    }

    private int runPrune(ImageFinder finder) {
        IndexHandle handle = resolveHandle(finder);
        if (handle == null) {
            return EXIT_USAGE_ERROR;
        }
        int removed;
        try {
            removed = finder.pruneMissing(handle);
        } catch (StoreException e) {
            log.error("Unable to prune index {}", handle.name(), e);
            return EXIT_INDEX_FAILURE;
        }
        out.printf("Pruned %d missing file(s) from %s%n", removed, handle.name());
        return EXIT_OK;
    }

    private IndexHandle resolveHandle(ImageFinder finder) {
        if (indexName != null) {
            return finder.openIndex(indexName);
        }
        if (directory != null) {
            return finder.openIndex(IndexNames.forDirectory(directory));
        }
        log.error("--index or --directory is required in {} mode", mode);
        return null;
    }
}
