package com.fiberfit.service;

import com.fiberfit.model.AnalysisOutput;
import com.fiberfit.model.AnalysisRequest;
import com.fiberfit.model.AnalysisSettings;
import com.fiberfit.model.ArtifactImage;
import com.fiberfit.model.ArtifactKind;
import com.fiberfit.model.BatchEvent;
import com.fiberfit.model.DisplayGeometry;
import com.fiberfit.model.ErrorKind;
import com.fiberfit.model.ProcessedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the analysis over a list of files, strictly one after the other and in list order.
 * <p>
 * Each file produces exactly one event: {@link BatchEvent.ItemProcessed} or
 * {@link BatchEvent.ItemFailed}. A failing file never stops the batch. The batch is framed
 * by {@link BatchEvent.Started} and {@link BatchEvent.Completed}.
 */
public class BatchWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(BatchWorker.class);

    private final List<Path> files;
    private final AnalysisSettings settings;
    private final DisplayGeometry geometry;
    private final AnalysisAdapter adapter;
    private final ArtifactStore store;
    private final ErrorClassifier classifier;
    private final NotificationChannel channel;

    public BatchWorker(List<Path> files, AnalysisSettings settings, DisplayGeometry geometry,
                       AnalysisAdapter adapter, ArtifactStore store, ErrorClassifier classifier,
                       NotificationChannel channel) {
        this.files = List.copyOf(files);
        this.settings = settings;
        this.geometry = geometry;
        this.adapter = adapter;
        this.store = store;
        this.classifier = classifier;
        this.channel = channel;
    }

    @Override
    public void run() {
        List<ProcessedResult> processed = new ArrayList<>();
        int failed = 0;
        boolean lastSucceeded = false;
        long start = System.nanoTime();
        logger.info("Batch started: {} file(s), {}", files.size(), settings);
        try {
            channel.publish(new BatchEvent.Started(files.size()));
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                BatchEvent event;
                try {
                    AnalysisOutput output = adapter.analyze(new AnalysisRequest(file, settings, geometry,
                            store.getSessionDirectory(), store.peekNextSequenceNumber()));
                    ProcessedResult result = persist(file, output);
                    processed.add(result);
                    lastSucceeded = true;
                    event = new BatchEvent.ItemProcessed(processed.size(), result, processed,
                            i == files.size() - 1, output.elapsedSeconds, store.peekNextSequenceNumber());
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception | Error e) {
                    // an Error raised for one image fails that file only
                    ErrorKind kind = classifier.classify(e);
                    logger.warn("{} failed ({}): {}", file, kind, e.toString());
                    logger.debug("Failure detail for {}", file, e);
                    failed++;
                    lastSucceeded = false;
                    event = new BatchEvent.ItemFailed(files, processed.size(), kind, i, String.valueOf(e.getMessage()));
                }
                channel.publish(event);
            }
            channel.publish(new BatchEvent.Completed(processed.size(), failed, lastSucceeded));
            logger.info("Batch finished in {} ms: {} processed, {} failed",
                    (System.nanoTime() - start) / 1_000_000, processed.size(), failed);
        } catch (InterruptedException e) {
            logger.warn("Batch interrupted after {} of {} file(s)", processed.size() + failed, files.size());
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Takes the next sequence number and stores the four artifacts under it. On a write
     * failure the files already written for that number are removed; the number itself is
     * not handed out again.
     */
    private ProcessedResult persist(Path file, AnalysisOutput output) throws IOException {
        int number = store.nextSequenceNumber();
        Map<ArtifactKind, ArtifactImage> artifacts = new EnumMap<>(ArtifactKind.class);
        try {
            for (ArtifactKind kind : ArtifactKind.values()) {
                byte[] png = store.write(kind, number, output.image(kind));
                artifacts.put(kind, new ArtifactImage(output.image(kind), Base64.getMimeEncoder().encodeToString(png)));
            }
        } catch (IOException | RuntimeException | Error e) {
            try {
                store.deleteArtifacts(number);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        return new ProcessedResult(file, output.k, output.th, output.r2, output.sig, artifacts,
                LocalDateTime.now(), number, settings);
    }
}
