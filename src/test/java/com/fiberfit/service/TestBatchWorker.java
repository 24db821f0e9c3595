package com.fiberfit.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fiberfit.model.AnalysisOutput;
import com.fiberfit.model.AnalysisRequest;
import com.fiberfit.model.AnalysisSettings;
import com.fiberfit.model.ArtifactKind;
import com.fiberfit.model.BatchEvent;
import com.fiberfit.model.DisplayGeometry;
import com.fiberfit.model.ErrorKind;

public class TestBatchWorker {

    @TempDir
    Path base;

    private ArtifactStore store;
    private RecordingListener listener;
    private NotificationChannel channel;

    @BeforeEach
    public void setUp() throws IOException {
        store = new ArtifactStore(base);
        store.allocateSessionDirectory();
        listener = new RecordingListener();
        channel = new NotificationChannel(1024, Runnable::run, listener);
    }

    private void run(AnalysisAdapter adapter, Path... files) {
        run(adapter, AnalysisSettings.defaults(), files);
    }

    private void run(AnalysisAdapter adapter, AnalysisSettings settings, Path... files) {
        new BatchWorker(List.of(files), settings, DisplayGeometry.UNKNOWN,
                adapter, store, new ErrorClassifier(), channel).run();
    }

    @Test
    public void test_mixedBatch() {
        var adapter = new FakeAnalysisAdapter()
                .failWith("b.png", () -> new NonSquareImageException(Path.of("b.png"), 10, 20));
        run(adapter, Path.of("a.png"), Path.of("b.png"), Path.of("c.png"));

        assertEquals(5, listener.events.size());
        assertEquals(new BatchEvent.Started(3), listener.events.get(0));

        var first = (BatchEvent.ItemProcessed)listener.events.get(1);
        assertEquals(1, first.processedCount());
        assertEquals(1, first.result().sequenceNumber);
        assertFalse(first.last());
        assertEquals(2, first.nextSequenceNumber());

        var failed = (BatchEvent.ItemFailed)listener.events.get(2);
        assertEquals(ErrorKind.IMAGE_SHAPE_OR_OTHER, failed.kind());
        assertEquals(1, failed.processedCount());
        assertEquals(Path.of("b.png"), failed.file());
        assertTrue(failed.message().contains("square"));

        var second = (BatchEvent.ItemProcessed)listener.events.get(3);
        assertEquals(2, second.processedCount());
        assertEquals(2, second.result().sequenceNumber);
        assertTrue(second.last());
        assertEquals(2, second.resultsSoFar().size());

        assertEquals(new BatchEvent.Completed(2, 1, true), listener.events.get(4));
    }

    @Test
    public void test_processedCountFollowsSuccesses() {
        var adapter = new FakeAnalysisAdapter()
                .failWith("f1.png", ArithmeticException::new)
                .failWith("f3.png", ArithmeticException::new);
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 6; i++) files.add(Path.of("f" + i + ".png"));
        run(adapter, files.toArray(new Path[0]));

        assertEquals(files, adapter.calls);
        int successes = 0;
        int fileIndex = 0;
        for (BatchEvent e : listener.events) {
            if (e instanceof BatchEvent.ItemProcessed) {
                successes++;
                var p = (BatchEvent.ItemProcessed)e;
                assertEquals(successes, p.processedCount());
                assertEquals(successes, p.result().sequenceNumber);
                assertEquals(files.get(fileIndex), p.result().source);
                fileIndex++;
            } else if (e instanceof BatchEvent.ItemFailed) {
                var f = (BatchEvent.ItemFailed)e;
                assertEquals(successes, f.processedCount());
                assertEquals(fileIndex, f.fileIndex());
                fileIndex++;
            }
        }
        assertEquals(4, successes);
        assertEquals(6, fileIndex);
    }

    @Test
    public void test_sequenceContinuesAcrossBatches() {
        run(new FakeAnalysisAdapter(), Path.of("a.png"), Path.of("b.png"));
        run(new FakeAnalysisAdapter(), Path.of("a.png"));
        var processed = listener.ofType(BatchEvent.ItemProcessed.class);
        assertEquals(3, processed.size());
        assertEquals(3, processed.get(2).result().sequenceNumber);
        assertEquals(4, store.peekNextSequenceNumber());
    }

    @Test
    public void test_settingsErrorInTheMiddle() {
        var adapter = new FakeAnalysisAdapter().failWith("b.png", () -> new ArithmeticException("/ by zero"));
        run(adapter, Path.of("a.png"), Path.of("b.png"), Path.of("c.png"));

        var failures = listener.ofType(BatchEvent.ItemFailed.class);
        assertEquals(1, failures.size());
        assertEquals(ErrorKind.SETTINGS_OUT_OF_DOMAIN, failures.get(0).kind());
        assertEquals(1, failures.get(0).fileIndex());
        assertEquals(2, listener.ofType(BatchEvent.ItemProcessed.class).size());
    }

    @Test
    public void test_allFailed() {
        var adapter = new FakeAnalysisAdapter()
                .failWith("a.txt", () -> new UnsupportedImageException(Path.of("a.txt"), "not an image"))
                .failWith("b.txt", () -> new UnsupportedImageException(Path.of("b.txt"), "not an image"));
        run(adapter, Path.of("a.txt"), Path.of("b.txt"));

        assertEquals(4, listener.events.size());
        assertTrue(listener.ofType(BatchEvent.ItemFailed.class).stream()
                .allMatch(f -> f.kind() == ErrorKind.UNSUPPORTED_IMAGE));
        assertEquals(new BatchEvent.Completed(0, 2, false), listener.events.get(3));
        assertEquals(1, store.peekNextSequenceNumber());
    }

    @Test
    public void test_artifactsAreWritten() throws IOException {
        run(new FakeAnalysisAdapter(), Path.of("a.png"));
        var result = listener.ofType(BatchEvent.ItemProcessed.class).get(0).result();
        for (ArtifactKind kind : ArtifactKind.values()) {
            Path file = store.artifactPath(kind, 1);
            assertTrue(Files.isRegularFile(file), kind.fileName(1));
            assertFalse(result.artifact(kind).base64().isEmpty());
        }
    }

    @Test
    public void test_writeFailureRemovesPartialArtifacts() throws IOException {
        store = new ArtifactStore(base.resolve("failing")) {
            @Override
            public byte[] write(ArtifactKind kind, int sequenceNumber, BufferedImage image) throws IOException {
                if (sequenceNumber == 1 && kind == ArtifactKind.ANGULAR_DISTRIBUTION)
                    throw new IOException("disk full");
                return super.write(kind, sequenceNumber, image);
            }
        };
        Files.createDirectories(base.resolve("failing"));
        store.allocateSessionDirectory();

        run(new FakeAnalysisAdapter(), Path.of("a.png"), Path.of("b.png"));

        var failed = listener.ofType(BatchEvent.ItemFailed.class);
        assertEquals(1, failed.size());
        assertEquals(ErrorKind.IMAGE_SHAPE_OR_OTHER, failed.get(0).kind());
        for (ArtifactKind kind : ArtifactKind.values())
            assertFalse(Files.exists(store.artifactPath(kind, 1)), kind.fileName(1));

        var processed = listener.ofType(BatchEvent.ItemProcessed.class);
        assertEquals(1, processed.size());
        assertEquals(2, processed.get(0).result().sequenceNumber);
        assertEquals(1, processed.get(0).processedCount());
    }

    @Test
    public void test_interruptStopsBatch() throws Exception {
        ExecutorService exec = Executors.newSingleThreadExecutor();
        var adapter = new FakeAnalysisAdapter() {
            @Override
            public AnalysisOutput analyze(AnalysisRequest request) throws Exception {
                super.analyze(request);
                Thread.sleep(60_000);
                return output(1);
            }
        };
        var future = exec.submit(() -> run(adapter, Path.of("a.png"), Path.of("b.png")));
        while (adapter.calls.isEmpty()) Thread.sleep(10);
        future.cancel(true);
        exec.shutdown();
        assertTrue(exec.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1, adapter.calls.size());
        assertTrue(listener.ofType(BatchEvent.Completed.class).isEmpty());
    }

    @Test
    public void test_errorInTheMiddleDoesNotStopBatch() {
        var adapter = new FakeAnalysisAdapter().failWith("b.png", () -> {
            throw new StackOverflowError("deep");
        });
        run(adapter, Path.of("a.png"), Path.of("b.png"), Path.of("c.png"));

        assertEquals(5, listener.events.size());
        var failures = listener.ofType(BatchEvent.ItemFailed.class);
        assertEquals(1, failures.size());
        assertEquals(ErrorKind.IMAGE_SHAPE_OR_OTHER, failures.get(0).kind());
        assertEquals(1, failures.get(0).fileIndex());

        var processed = listener.ofType(BatchEvent.ItemProcessed.class);
        assertEquals(2, processed.size());
        assertEquals(Path.of("c.png"), processed.get(1).result().source);
        assertTrue(processed.get(1).last());
        assertEquals(new BatchEvent.Completed(2, 1, true), listener.events.get(4));
    }

    @Test
    public void test_errorWhileWritingRemovesPartialArtifacts() throws IOException {
        store = new ArtifactStore(base.resolve("broken")) {
            @Override
            public byte[] write(ArtifactKind kind, int sequenceNumber, BufferedImage image) throws IOException {
                if (kind == ArtifactKind.CARTESIAN_DISTRIBUTION) throw new OutOfMemoryError("png buffer");
                return super.write(kind, sequenceNumber, image);
            }
        };
        store.allocateSessionDirectory();

        run(new FakeAnalysisAdapter(), Path.of("a.png"));

        assertEquals(1, listener.ofType(BatchEvent.ItemFailed.class).size());
        assertEquals(new BatchEvent.Completed(0, 1, false), listener.events.get(2));
        for (ArtifactKind kind : ArtifactKind.values())
            assertFalse(Files.exists(store.artifactPath(kind, 1)), kind.fileName(1));
    }

    @Test
    public void test_extremeSettingsFailEveryFileAsSettingsError() throws IOException {
        Path a = SampleImages.writePng(SampleImages.stripes(64, true), base.resolve("a.png"));
        Path b = SampleImages.writePng(SampleImages.stripes(64, false), base.resolve("b.png"));
        run(new FiberOrientationService(), new AnalysisSettings(32, 2, 1e-7, 0.1), a, b);

        var failures = listener.ofType(BatchEvent.ItemFailed.class);
        assertEquals(2, failures.size());
        assertTrue(failures.stream().allMatch(f -> f.kind() == ErrorKind.SETTINGS_OUT_OF_DOMAIN));
        assertEquals(new BatchEvent.Completed(0, 2, false), listener.events.get(3));
    }
}
