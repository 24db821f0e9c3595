package com.fiberfit.model;

/**
 * The four rendered images stored for every processed file. The prefix is part of the
 * on-disk name: {@code <prefix>_<sequence>.png}.
 */
public enum ArtifactKind {

    ORIGINAL("orgImg", "Analyzed Image"),
    LOG_SCALE("logScl", "FFT Power Spectrum"),
    ANGULAR_DISTRIBUTION("angDist", "Red Line = Fiber Orientation"),
    CARTESIAN_DISTRIBUTION("cartDist", "Blue Line = Fiber Distribution");

    private final String prefix;
    private final String caption;

    ArtifactKind(String prefix, String caption) {
        this.prefix = prefix;
        this.caption = caption;
    }

    public String prefix() {
        return prefix;
    }

    public String caption() {
        return caption;
    }

    public String fileName(int sequenceNumber) {
        return prefix + "_" + sequenceNumber + ".png";
    }
}
