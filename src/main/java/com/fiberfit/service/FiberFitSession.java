package com.fiberfit.service;

import com.fiberfit.model.AnalysisSettings;
import com.fiberfit.model.BatchEvent;
import com.fiberfit.model.BatchListener;
import com.fiberfit.model.DisplayGeometry;
import com.fiberfit.model.ProcessedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One analysis session: launches batches, owns the result list and the cursor, and
 * clears everything including the artifact directory.
 * <p>
 * Batch events are handled on the consumer executor given at construction; the result
 * store, cursor and {@code started} flag must only be touched from there. Only one batch
 * runs at a time.
 */
public class FiberFitSession implements BatchListener, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FiberFitSession.class);

    private final AnalysisAdapter adapter;
    private final ArtifactStore artifactStore;
    private final ErrorClassifier classifier = new ErrorClassifier();
    private final ExecutorService exec;
    private final NotificationChannel channel;

    private final ResultStore results = new ResultStore();
    private final NavigationController navigation = new NavigationController(results);
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private Future<?> running;
    private boolean started = false;
    private int batchTotal = 0;

    public FiberFitSession(AnalysisAdapter adapter, ArtifactStore artifactStore, Executor consumerExecutor) {
        this.adapter = adapter;
        this.artifactStore = artifactStore;
        this.channel = new NotificationChannel(consumerExecutor, this);
        this.exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fiberfit-batch");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(SessionListener l) {
        listeners.add(l);
    }

    public void removeListener(SessionListener l) {
        listeners.remove(l);
    }

    /**
     * Starts a batch over {@code files}. The artifact directory is created on the first
     * launch of the session; if that fails nothing is started.
     *
     * @throws IllegalStateException if a batch is still running
     * @throws IOException if the artifact directory cannot be created
     */
    public synchronized void launch(List<Path> files, AnalysisSettings settings, DisplayGeometry geometry) throws IOException {
        if (isRunning())
            throw new IllegalStateException("A batch is already running");
        if (files.isEmpty()) {
            logger.info("Nothing to analyze");
            return;
        }
        if (!artifactStore.hasSessionDirectory())
            artifactStore.allocateSessionDirectory();
        BatchWorker worker = new BatchWorker(files, settings, geometry, adapter, artifactStore, classifier, channel);
        running = exec.submit(worker);
    }

    public synchronized boolean isRunning() {
        return running != null && !running.isDone();
    }

    /**
     * Waits for the current batch, if any, to finish on the worker side.
     */
    public void awaitBatch(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        Future<?> f;
        synchronized (this) {
            f = running;
        }
        if (f == null) return;
        try {
            f.get(timeout, unit);
        } catch (ExecutionException e) {
            logger.error("Batch worker failed", e.getCause());
        }
    }

    /**
     * Empties the results, resets the sequence numbers and deletes the artifact directory.
     *
     * @throws IllegalStateException if a batch is still running
     */
    public void clear() throws IOException {
        if (isRunning())
            throw new IllegalStateException("Cannot clear while a batch is running");
        // events of the finished batch that were not delivered yet
        channel.drain();
        results.removeAll();
        navigation.reset();
        started = false;
        batchTotal = 0;
        artifactStore.resetSequence();
        artifactStore.purgeSession();
        for (SessionListener l : listeners) l.onCleared();
    }

    /** Read-only snapshot of the result at {@code index} for reporting. */
    public ProcessedResult export(int index) {
        return results.get(index);
    }

    public Optional<ProcessedResult> exportCurrent() {
        return navigation.current();
    }

    public boolean isStarted() {
        return started;
    }

    public ResultStore getResults() {
        return results;
    }

    public NavigationController getNavigation() {
        return navigation;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    // --- CONSUMER SIDE ---
    @Override
    public void onStarted(BatchEvent.Started event) {
        batchTotal = event.total();
        for (SessionListener l : listeners) l.onBatchStarted(event.total());
    }

    @Override
    public void onItemProcessed(BatchEvent.ItemProcessed event) {
        int index = results.upsert(event.result());
        ProcessedResult shown = navigation.selectClamped(index).orElseThrow();
        started = true;
        for (SessionListener l : listeners) {
            l.onResultSelected(shown, navigation.getIndex());
            l.onProgress(event.processedCount(), batchTotal);
        }
    }

    @Override
    public void onItemFailed(BatchEvent.ItemFailed event) {
        for (SessionListener l : listeners) l.onFailure(event);
    }

    @Override
    public void onCompleted(BatchEvent.Completed event) {
        for (SessionListener l : listeners) l.onBatchFinished(event);
    }

    /**
     * Stops the worker and removes the artifact directory.
     */
    @Override
    public void close() {
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS))
                logger.warn("Batch worker did not stop in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            artifactStore.purgeSession();
        } catch (IOException e) {
            logger.warn("Unable to remove artifact directory: {}", e.getMessage());
        }
    }
}
