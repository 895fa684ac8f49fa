package com.sifinder.service;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sifinder.TestImages;
import com.sifinder.fingerprint.DecodeException;
import com.sifinder.ingest.IndexingReport;
import com.sifinder.ingest.ProgressListener;
import com.sifinder.runtime.AppConfig;
import com.sifinder.search.Match;
import com.sifinder.store.IndexNames;
import com.sifinder.store.IndexNotFoundException;
import com.sifinder.store.IndexSummary;
import com.sifinder.store.SqliteIndexStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageFinderTest {

    @TempDir
    Path tempDir;

    private Path photos;
    private ImageFinder finder;

    @BeforeEach
    void setUp() throws Exception {
        photos = Files.createDirectories(tempDir.resolve("photos"));
        finder = ImageFinder.create(tempDir.resolve("data"), new AppConfig());
    }

    @Test
    void identicalImagesMatchAtZeroThresholdAndUnrelatedOneDoesNot() throws Exception {
        Path a = TestImages.writePng(photos.resolve("a.png"), 1);
        Path b = Files.copy(a, photos.resolve("b.png"));
        TestImages.writePng(photos.resolve("c.png"), 2);
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.runIndex(handle, ProgressListener.NONE);

        List<Match> matches = finder.runSearch(handle, a, 0);

        assertEquals(List.of(
                new Match(0, a.toAbsolutePath().normalize().toString()),
                new Match(0, b.toAbsolutePath().normalize().toString())), matches);
    }

    @Test
    void deletedFileShouldDisappearFromResultsButStayStored() throws Exception {
        Path a = TestImages.writePng(photos.resolve("a.png"), 1);
        Path b = Files.copy(a, photos.resolve("b.png"));
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.runIndex(handle, ProgressListener.NONE);

        Files.delete(b);
        List<Match> matches = finder.runSearch(handle, a, 8);

        assertEquals(List.of(new Match(0, a.toAbsolutePath().normalize().toString())), matches);
        try (SqliteIndexStore store = finder.catalog().openExisting(handle.name())) {
            assertEquals(2, store.recordCount());
        }
    }

    @Test
    void corruptFileShouldNotAbortIndexing() throws Exception {
        TestImages.writePng(photos.resolve("a.png"), 1);
        TestImages.writeCorrupt(photos.resolve("b.png"));
        TestImages.writePng(photos.resolve("c.png"), 3);
        IndexHandle handle = finder.createOrOpenIndex(photos);

        IndexingReport report = finder.runIndex(handle, ProgressListener.NONE);

        assertEquals(2, report.hashedFiles());
        assertEquals(1, report.failedCount());
        try (SqliteIndexStore store = finder.catalog().openExisting(handle.name())) {
            assertEquals(2, store.recordCount());
        }
    }

    @Test
    void reindexingSameDirectoryShouldReuseOneStore() throws Exception {
        IndexHandle first = finder.createOrOpenIndex(photos);
        IndexHandle second = finder.createOrOpenIndex(photos.resolve("..").resolve("photos"));

        assertEquals(first, second);
        assertEquals(IndexNames.forDirectory(photos), first.name());
        assertEquals(1, finder.listIndexes().size());
    }

    @Test
    void shouldNotCreateStoreForMissingOrNonDirectoryTarget() throws Exception {
        Path file = TestImages.writePng(tempDir.resolve("single.png"), 1);

        assertThrows(NoSuchFileException.class, () -> finder.createOrOpenIndex(tempDir.resolve("absent")));
        assertThrows(NotDirectoryException.class, () -> finder.createOrOpenIndex(file));
        assertTrue(finder.listIndexes().isEmpty());
    }

    @Test
    void shouldListOpenAndDeleteIndexes() throws Exception {
        TestImages.writePng(photos.resolve("a.png"), 1);
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.runIndex(handle, ProgressListener.NONE);

        assertEquals(List.of(new IndexSummary(handle.name(), photos.toAbsolutePath().normalize().toString())),
                finder.listIndexes());
        assertEquals(handle, finder.openIndex(handle.name()));

        finder.deleteIndex(handle.name());

        assertTrue(finder.listIndexes().isEmpty());
        assertThrows(IndexNotFoundException.class, () -> finder.openIndex(handle.name()));
        assertThrows(IndexNotFoundException.class, () -> finder.runSearch(handle, photos.resolve("a.png"), 8));
        assertThrows(IndexNotFoundException.class, () -> finder.deleteIndex(handle.name()));
    }

    @Test
    void undecodableQueryIsARecoverableFailure() throws Exception {
        TestImages.writePng(photos.resolve("a.png"), 1);
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.runIndex(handle, ProgressListener.NONE);
        Path query = Files.writeString(tempDir.resolve("query.png"), "garbage");

        assertThrows(DecodeException.class, () -> finder.runSearch(handle, query, 8));
        assertEquals(1, finder.runSearch(handle, photos.resolve("a.png"), 8).size());
    }

    @Test
    void pruneShouldRemoveOnlyMissingFiles() throws Exception {
        TestImages.writePng(photos.resolve("a.png"), 1);
        Path b = TestImages.writePng(photos.resolve("b.png"), 2);
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.runIndex(handle, ProgressListener.NONE);
        Files.delete(b);

        assertEquals(1, finder.pruneMissing(handle));
        assertEquals(0, finder.pruneMissing(handle));
        try (SqliteIndexStore store = finder.catalog().openExisting(handle.name())) {
            assertEquals(1, store.recordCount());
            assertFalse(store.modifiedTime(b.toAbsolutePath().normalize().toString()).isPresent());
        }
    }
}
