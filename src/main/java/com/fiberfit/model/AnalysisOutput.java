package com.fiberfit.model;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class AnalysisOutput {
    public final double k;
    public final double th;            // mean orientation (degrees)
    public final double r2;
    public final double[] sig;

    public final int figureWidth;      // layout hints (px)
    public final int figureHeight;
    public final double elapsedSeconds;

    private final Map<ArtifactKind, BufferedImage> images;

    public AnalysisOutput(double k, double th, double r2, double[] sig, Map<ArtifactKind, BufferedImage> images,
                          int figureWidth, int figureHeight, double elapsedSeconds) {
        for (ArtifactKind kind : ArtifactKind.values()) {
            if (!images.containsKey(kind))
                throw new IllegalArgumentException("Missing artifact " + kind);
        }
        this.k = k;
        this.th = th;
        this.r2 = r2;
        this.sig = sig.clone();
        this.images = Collections.unmodifiableMap(new EnumMap<>(images));
        this.figureWidth = figureWidth;
        this.figureHeight = figureHeight;
        this.elapsedSeconds = elapsedSeconds;
    }

    public BufferedImage image(ArtifactKind kind) {
        return images.get(kind);
    }
}
