package com.fiberfit.model;

/**
 * Screen size and resolution handed through to the analysis so it can size its plots.
 * The pipeline never interprets these values.
 */
public record DisplayGeometry(double width, double height, double dpi) {

    public static final DisplayGeometry UNKNOWN = new DisplayGeometry(0, 0, 96);

    public boolean isKnown() {
        return width > 0 && height > 0;
    }
}
