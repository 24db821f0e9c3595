package com.fiberfit.model;

import java.util.Locale;

/**
 * Numeric parameters of one batch. Values are only checked for being finite;
 * whether they make sense for a given image is decided by the analysis itself.
 */
public class AnalysisSettings {

    public final double upperCut;
    public final double lowerCut;
    public final double angleIncrement;
    public final double radialStep;

    public AnalysisSettings(double upperCut, double lowerCut, double angleIncrement, double radialStep) {
        requireFinite("upperCut", upperCut);
        requireFinite("lowerCut", lowerCut);
        requireFinite("angleIncrement", angleIncrement);
        requireFinite("radialStep", radialStep);
        this.upperCut = upperCut;
        this.lowerCut = lowerCut;
        this.angleIncrement = angleIncrement;
        this.radialStep = radialStep;
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(AppConfig.DEFAULT_UPPER_CUT, AppConfig.DEFAULT_LOWER_CUT,
                AppConfig.DEFAULT_ANGLE_INC, AppConfig.DEFAULT_RADIAL_STEP);
    }

    private static void requireFinite(String name, double v) {
        if (Double.isNaN(v) || Double.isInfinite(v))
            throw new IllegalArgumentException(name + " must be a finite number, got " + v);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "uCut=%.2f lCut=%.2f angleInc=%.2f radStep=%.2f",
                upperCut, lowerCut, angleIncrement, radialStep);
    }
}
