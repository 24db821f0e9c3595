package com.fiberfit.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Analysis parameters
    private static final String KEY_UPPER_CUT = "upper_cut";
    private static final String KEY_LOWER_CUT = "lower_cut";
    private static final String KEY_ANGLE_INC = "angle_increment";
    private static final String KEY_RADIAL_STEP = "radial_step";

    // Where the session directory with the rendered artifacts is created
    private static final String KEY_ARTIFACT_DIR = "artifact_base_dir";

    public static final double DEFAULT_UPPER_CUT = 32.0;
    public static final double DEFAULT_LOWER_CUT = 2.0;
    public static final double DEFAULT_ANGLE_INC = 1.0;
    public static final double DEFAULT_RADIAL_STEP = 0.1;

    // --- ANALYSIS SETTINGS ---
    public static double getUpperCut() { return prefs.getDouble(KEY_UPPER_CUT, DEFAULT_UPPER_CUT); }
    public static void setUpperCut(double v) { prefs.putDouble(KEY_UPPER_CUT, v); }

    public static double getLowerCut() { return prefs.getDouble(KEY_LOWER_CUT, DEFAULT_LOWER_CUT); }
    public static void setLowerCut(double v) { prefs.putDouble(KEY_LOWER_CUT, v); }

    public static double getAngleIncrement() { return prefs.getDouble(KEY_ANGLE_INC, DEFAULT_ANGLE_INC); }
    public static void setAngleIncrement(double v) { prefs.putDouble(KEY_ANGLE_INC, v); }

    public static double getRadialStep() { return prefs.getDouble(KEY_RADIAL_STEP, DEFAULT_RADIAL_STEP); }
    public static void setRadialStep(double v) { prefs.putDouble(KEY_RADIAL_STEP, v); }

    public static AnalysisSettings getSettings() {
        return new AnalysisSettings(getUpperCut(), getLowerCut(), getAngleIncrement(), getRadialStep());
    }

    public static void setSettings(AnalysisSettings s) {
        setUpperCut(s.upperCut);
        setLowerCut(s.lowerCut);
        setAngleIncrement(s.angleIncrement);
        setRadialStep(s.radialStep);
    }

    // --- ARTIFACTS ---
    public static String getArtifactBaseDir() {
        return prefs.get(KEY_ARTIFACT_DIR, System.getProperty("java.io.tmpdir"));
    }
    public static void setArtifactBaseDir(String v) { prefs.put(KEY_ARTIFACT_DIR, v); }
}
