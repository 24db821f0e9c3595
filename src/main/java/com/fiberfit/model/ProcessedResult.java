package com.fiberfit.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one successful analysis. Two results are equal when they come from the same
 * source file, which is what lets a re-analysed image replace its older entry.
 */
public class ProcessedResult {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("EEEE, dd. MMMM yyyy hh:mma", Locale.US);

    public final Path source;
    public final double k;
    public final double th;
    public final double r2;
    private final double[] sig;

    public final LocalDateTime createdAt;
    public final int sequenceNumber;     // resolves the artifact file names
    public final AnalysisSettings settings;

    private final Map<ArtifactKind, ArtifactImage> artifacts;

    public ProcessedResult(Path source, double k, double th, double r2, double[] sig,
                           Map<ArtifactKind, ArtifactImage> artifacts, LocalDateTime createdAt,
                           int sequenceNumber, AnalysisSettings settings) {
        this.source = Objects.requireNonNull(source, "source");
        this.k = k;
        this.th = th;
        this.r2 = r2;
        this.sig = sig.clone();
        this.artifacts = Collections.unmodifiableMap(new EnumMap<>(artifacts));
        this.createdAt = createdAt;
        this.sequenceNumber = sequenceNumber;
        this.settings = settings;
    }

    /** File name without its extension, as shown in the result list. */
    public String displayName() {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public double sigma() {
        return sig.length > 0 ? sig[0] : Double.NaN;
    }

    public double[] sig() {
        return sig.clone();
    }

    public ArtifactImage artifact(ArtifactKind kind) {
        return artifacts.get(kind);
    }

    public String timestamp() {
        return createdAt.format(TIMESTAMP);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessedResult)) return false;
        return source.equals(((ProcessedResult) o).source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s #%d (k=%.2f, th=%.2f, R2=%.2f)", displayName(), sequenceNumber, k, th, r2);
    }
}
