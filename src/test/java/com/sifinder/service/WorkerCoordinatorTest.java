package com.sifinder.service;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sifinder.TestImages;
import com.sifinder.fingerprint.DecodeException;
import com.sifinder.fingerprint.Fingerprint;
import com.sifinder.fingerprint.FingerprintExtractor;
import com.sifinder.fingerprint.PerceptualHashExtractor;
import com.sifinder.ingest.ProgressListener;
import com.sifinder.runtime.AppConfig;
import com.sifinder.service.OperationFailedEvent.FailureKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerCoordinatorTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    @TempDir
    Path tempDir;

    private Path photos;

    @BeforeEach
    void setUp() throws Exception {
        photos = Files.createDirectories(tempDir.resolve("photos"));
        TestImages.writePng(photos.resolve("a.png"), 1);
        TestImages.writePng(photos.resolve("b.png"), 2);
        TestImages.writePng(photos.resolve("c.png"), 3);
    }

    @Test
    void shouldReportIndexProgressAndCompletionAsMessages() throws Exception {
        AppConfig config = new AppConfig();
        config.getIndexing().setProgressInterval(1);
        ImageFinder finder = ImageFinder.create(tempDir.resolve("data"), config);
        IndexHandle handle = finder.createOrOpenIndex(photos);

        List<WorkerEvent> received = new ArrayList<>();
        try (WorkerCoordinator coordinator = new WorkerCoordinator(finder, 2)) {
            long generation = coordinator.submitIndex(handle);
            while (true) {
                WorkerEvent event = coordinator.poll(TIMEOUT).orElseThrow();
                assertEquals(generation, event.generation());
                received.add(event);
                if (event instanceof IndexCompletedEvent) {
                    break;
                }
            }
        }

        IndexCompletedEvent completed = (IndexCompletedEvent) received.get(received.size() - 1);
        assertEquals(3, completed.report().hashedFiles());
        assertEquals(WorkerCoordinator.indexSlot(handle.name()), completed.slot());
        assertEquals(3, received.stream().filter(IndexProgressEvent.class::isInstance).count());
    }

    @Test
    void shouldDiscardResultOfSupersededSearch() throws Exception {
        BlockingExtractor extractor = new BlockingExtractor("slow.png");
        ImageFinder finder = ImageFinder.create(tempDir.resolve("data"), new AppConfig(), extractor);
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.runIndex(handle, ProgressListener.NONE);
        Path slowQuery = Files.copy(photos.resolve("a.png"), tempDir.resolve("slow.png"));
        Path fastQuery = Files.copy(photos.resolve("b.png"), tempDir.resolve("fast.png"));

        try (WorkerCoordinator coordinator = new WorkerCoordinator(finder, 2)) {
            long stale = coordinator.submitSearch("main", handle, slowQuery, 0);
            assertTrue(extractor.entered.await(TIMEOUT.toSeconds(), TimeUnit.SECONDS));
            long fresh = coordinator.submitSearch("main", handle, fastQuery, 0);

            SearchCompletedEvent result = assertInstanceOf(SearchCompletedEvent.class, coordinator.poll(TIMEOUT).orElseThrow());
            assertEquals(fresh, result.generation());
            assertEquals(fastQuery, result.queryImage());
            assertEquals(1, result.matches().size());
            assertTrue(result.matches().get(0).path().endsWith("b.png"));

            extractor.release.countDown();
            assertTrue(stale < fresh);
            assertEquals(Optional.empty(), coordinator.poll(Duration.ofSeconds(2)));
        }
    }

    @Test
    void repeatedIndexRequestShouldJoinRunningPass() throws Exception {
        BlockingExtractor extractor = new BlockingExtractor("a.png");
        AppConfig config = new AppConfig();
        config.getWorkers().setPoolSize(2);
        ImageFinder finder = ImageFinder.create(tempDir.resolve("data"), config, extractor);
        IndexHandle handle = finder.createOrOpenIndex(photos);

        try (WorkerCoordinator coordinator = WorkerCoordinator.create(finder, config)) {
            long first = coordinator.submitIndex(handle);
            assertTrue(extractor.entered.await(TIMEOUT.toSeconds(), TimeUnit.SECONDS));
            long repeated = coordinator.submitIndex(handle);
            extractor.release.countDown();

            assertEquals(first, repeated);
            WorkerEvent event;
            do {
                event = coordinator.poll(TIMEOUT).orElseThrow();
                assertFalse(event instanceof OperationFailedEvent, "unexpected failure " + event);
            } while (!(event instanceof IndexCompletedEvent));
            assertEquals(first, event.generation());
            assertEquals(3, ((IndexCompletedEvent) event).report().hashedFiles());

            long next = coordinator.submitIndex(handle);
            assertTrue(next > first);
            IndexCompletedEvent rerun = assertInstanceOf(IndexCompletedEvent.class, nextNonProgress(coordinator));
            assertEquals(next, rerun.generation());
            assertEquals(3, rerun.report().unchangedFiles());
        }
    }

    @Test
    void shouldReportUndecodableQueryAsRecoverableFailure() throws Exception {
        ImageFinder finder = ImageFinder.create(tempDir.resolve("data"), new AppConfig());
        IndexHandle handle = finder.createOrOpenIndex(photos);
        Path query = TestImages.writeCorrupt(tempDir.resolve("broken.png"));

        try (WorkerCoordinator coordinator = new WorkerCoordinator(finder, 1)) {
            coordinator.submitSearch("main", handle, query, 8);
            OperationFailedEvent failure = assertInstanceOf(OperationFailedEvent.class, coordinator.poll(TIMEOUT).orElseThrow());

            assertEquals(FailureKind.DECODE, failure.kind());
            assertTrue(failure.recoverable());
        }
    }

    @Test
    void shouldReportMissingIndexAsNotFound() throws Exception {
        ImageFinder finder = ImageFinder.create(tempDir.resolve("data"), new AppConfig());
        IndexHandle handle = finder.createOrOpenIndex(photos);
        finder.deleteIndex(handle.name());

        try (WorkerCoordinator coordinator = new WorkerCoordinator(finder, 1)) {
            coordinator.submitSearch("main", handle, photos.resolve("a.png"), 8);
            OperationFailedEvent failure = assertInstanceOf(OperationFailedEvent.class, coordinator.poll(TIMEOUT).orElseThrow());

            assertEquals(FailureKind.NOT_FOUND, failure.kind());
        }
    }

    private static WorkerEvent nextNonProgress(WorkerCoordinator coordinator) throws InterruptedException {
        WorkerEvent event;
        do {
            event = coordinator.poll(TIMEOUT).orElseThrow();
        } while (event instanceof IndexProgressEvent);
        return event;
    }

    private static final class BlockingExtractor implements FingerprintExtractor {
        private final FingerprintExtractor delegate = new PerceptualHashExtractor();
        private final String blockedFileName;
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        BlockingExtractor(String blockedFileName) {
            this.blockedFileName = blockedFileName;
        }

        @Override
        public Fingerprint compute(Path image) throws DecodeException {
            if (image.getFileName().toString().equals(blockedFileName)) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DecodeException("interrupted", e);
                }
            }
            return delegate.compute(image);
        }

        @Override
        public Fingerprint compute(BufferedImage image) {
            return delegate.compute(image);
        }
    }
}
