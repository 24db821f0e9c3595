package com.fiberfit.service;

import com.fiberfit.model.ArtifactKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * On-disk storage of the rendered artifacts of one session.
 * <p>
 * The session directory is created lazily under a base directory with a random numeric
 * suffix. Artifact names are built from a sequence number that only grows until
 * {@link #resetSequence()}, so files of earlier results are never overwritten.
 */
public class ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String DEFAULT_PREFIX = "temp";
    public static final int DEFAULT_MAX_ATTEMPTS = 100;
    private static final int SUFFIX_BOUND = 100_000_000;

    private final Path baseDirectory;
    private final String prefix;
    private final Random random;
    private final int maxAttempts;

    private final AtomicInteger sequence = new AtomicInteger(0);
    private volatile Path sessionDirectory;

    public ArtifactStore(Path baseDirectory) {
        this(baseDirectory, DEFAULT_PREFIX, new Random(), DEFAULT_MAX_ATTEMPTS);
    }

    public ArtifactStore(Path baseDirectory, String prefix, Random random, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.baseDirectory = baseDirectory;
        this.prefix = prefix;
        this.random = random;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Creates a fresh, uniquely named session directory. Name collisions are retried with a
     * new suffix up to the attempt limit; any other I/O failure is thrown as is.
     */
    public synchronized Path allocateSessionDirectory() throws IOException {
        Files.createDirectories(baseDirectory);
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Path candidate = baseDirectory.resolve(prefix + random.nextInt(SUFFIX_BOUND));
            if (Files.exists(candidate)) continue;
            try {
                Files.createDirectory(candidate);
            } catch (FileAlreadyExistsException e) {
                logger.debug("{} was taken concurrently, retrying", candidate);
                continue;
            }
            sessionDirectory = candidate;
            logger.info("Artifact directory created: {}", candidate);
            return candidate;
        }
        throw new IOException("Could not find a free artifact directory name under " + baseDirectory
                + " after " + maxAttempts + " attempts");
    }

    public boolean hasSessionDirectory() {
        return sessionDirectory != null;
    }

    public Path getSessionDirectory() {
        Path dir = sessionDirectory;
        if (dir == null) throw new IllegalStateException("No artifact directory allocated");
        return dir;
    }

    public Path artifactPath(ArtifactKind kind, int sequenceNumber) {
        return getSessionDirectory().resolve(kind.fileName(sequenceNumber));
    }

    /**
     * Writes {@code image} as PNG and returns the bytes that were written.
     */
    public byte[] write(ArtifactKind kind, int sequenceNumber, BufferedImage image) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", bytes))
            throw new IOException("No PNG writer for image type " + image.getType());
        Path target = artifactPath(kind, sequenceNumber);
        Files.write(target, bytes.toByteArray());
        logger.debug("Wrote {}", target);
        return bytes.toByteArray();
    }

    /** Removes whatever artifacts exist for {@code sequenceNumber}. */
    public void deleteArtifacts(int sequenceNumber) throws IOException {
        if (sessionDirectory == null) return;
        for (ArtifactKind kind : ArtifactKind.values())
            Files.deleteIfExists(artifactPath(kind, sequenceNumber));
    }

    // --- SEQUENCE ---
    public int nextSequenceNumber() {
        return sequence.incrementAndGet();
    }

    /** The number the next success will receive. */
    public int peekNextSequenceNumber() {
        return sequence.get() + 1;
    }

    public void resetSequence() {
        sequence.set(0);
    }

    /**
     * Deletes the session directory and everything in it. Does nothing when no directory
     * was ever created or it is already gone.
     */
    public synchronized void purgeSession() throws IOException {
        Path dir = sessionDirectory;
        if (dir == null) return;
        if (Files.exists(dir)) {
            List<Path> paths;
            try (Stream<Path> walk = Files.walk(dir)) {
                paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            }
            for (Path p : paths) Files.deleteIfExists(p);
            logger.info("Artifact directory removed: {}", dir);
        }
        sessionDirectory = null;
    }
}
