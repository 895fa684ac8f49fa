package com.sifinder.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sifinder.fingerprint.DecodeException;
import com.sifinder.ingest.IndexingReport;
import com.sifinder.runtime.AppConfig;
import com.sifinder.search.Match;
import com.sifinder.service.OperationFailedEvent.FailureKind;
import com.sifinder.store.IndexBusyException;
import com.sifinder.store.IndexNotFoundException;
import com.sifinder.store.StoreException;

/**
 * Runs index and search requests on worker threads. Workers only talk back through the event
 * queue; {@link #poll(Duration)} and {@link #drain()} drop events from superseded generations so a
 * slow, older search can never replace the results of a newer one.
 */
public class WorkerCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerCoordinator.class);

    private final ImageFinder finder;
    private final ExecutorService executor;
    private final BlockingQueue<WorkerEvent> events = new LinkedBlockingQueue<>();
    private final GenerationTracker generations = new GenerationTracker();
    private final Map<String, Long> runningIndexPasses = new ConcurrentHashMap<>();

    public WorkerCoordinator(ImageFinder finder, int poolSize) {
        this.finder = finder;
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize), new WorkerThreadFactory());
    }

    public static WorkerCoordinator create(ImageFinder finder, AppConfig config) {
        return new WorkerCoordinator(finder, config.getWorkers().getPoolSize());
    }

    public static String indexSlot(String indexName) {
        return "index:" + indexName;
    }

    /**
     * Starts an indexing pass, or returns the generation of the pass already running on this index.
     * A running pass is never superseded, so its progress and completion events keep flowing.
     */
    public synchronized long submitIndex(IndexHandle handle) {
        String slot = indexSlot(handle.name());
        Long running = runningIndexPasses.get(slot);
        if (running != null) {
            log.info("coordinator.index.joined slot={} generation={}", slot, running);
            return running;
        }
        long generation = generations.next(slot);
        runningIndexPasses.put(slot, generation);
        try {
            executor.execute(() -> runIndex(slot, generation, handle));
        } catch (RejectedExecutionException e) {
            runningIndexPasses.remove(slot, generation);
            throw e;
        }
        return generation;
    }

    public long submitSearch(String slot, IndexHandle handle, Path queryImage, int threshold) {
        long generation = generations.next(slot);
        executor.execute(() -> runSearch(slot, generation, handle, queryImage, threshold));
        return generation;
    }

    public boolean isCurrent(WorkerEvent event) {
        return generations.isCurrent(event.slot(), event.generation());
    }

    /**
     * Waits up to {@code timeout} for the next event that is still current.
     */
    public Optional<WorkerEvent> poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            WorkerEvent event = events.poll(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            if (event == null) {
                return Optional.empty();
            }
            if (isCurrent(event)) {
                return Optional.of(event);
            }
            discard(event);
        }
    }

    public List<WorkerEvent> drain() {
        List<WorkerEvent> pending = new ArrayList<>();
        events.drainTo(pending);
        List<WorkerEvent> current = new ArrayList<>();
        for (WorkerEvent event : pending) {
            if (isCurrent(event)) {
                current.add(event);
            } else {
                discard(event);
            }
        }
        return current;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("coordinator.shutdown.timeout pending workers interrupted");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runIndex(String slot, long generation, IndexHandle handle) {
        WorkerEvent outcome;
        try {
            IndexingReport report = finder.runIndex(handle,
                    progress -> events.add(new IndexProgressEvent(slot, generation, handle.name(), progress)));
            outcome = new IndexCompletedEvent(slot, generation, report);
        } catch (Exception e) {
            outcome = failure(slot, generation, e);
        }
        // Released before publishing so a caller reacting to the outcome can start a fresh pass.
        runningIndexPasses.remove(slot, generation);
        events.add(outcome);
    }

    private void runSearch(String slot, long generation, IndexHandle handle, Path queryImage, int threshold) {
        try {
            List<Match> matches = finder.runSearch(handle, queryImage, threshold);
            events.add(new SearchCompletedEvent(slot, generation, handle.name(), queryImage, matches));
        } catch (Exception e) {
            events.add(failure(slot, generation, e));
        }
    }

    private OperationFailedEvent failure(String slot, long generation, Exception e) {
        FailureKind kind = classify(e);
        if (kind == FailureKind.UNEXPECTED || kind == FailureKind.STORE) {
            log.error("worker.failed slot={} generation={} kind={}", slot, generation, kind, e);
        } else {
            log.warn("worker.failed slot={} generation={} kind={} reason={}", slot, generation, kind, e.getMessage());
        }
        return new OperationFailedEvent(slot, generation, kind, String.valueOf(e.getMessage()));
    }

    static FailureKind classify(Exception e) {
        if (e instanceof DecodeException) {
            return FailureKind.DECODE;
        }
        if (e instanceof IndexNotFoundException) {
            return FailureKind.NOT_FOUND;
        }
        if (e instanceof IndexBusyException) {
            return FailureKind.BUSY;
        }
        if (e instanceof StoreException) {
            return FailureKind.STORE;
        }
        if (e instanceof IOException) {
            return FailureKind.IO;
        }
        if (e instanceof IllegalArgumentException) {
            return FailureKind.INVALID_REQUEST;
        }
        return FailureKind.UNEXPECTED;
    }

    private void discard(WorkerEvent event) {
        log.debug("coordinator.event.superseded slot={} generation={} current={}",
                event.slot(), event.generation(), generations.current(event.slot()));
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "si-finder-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
