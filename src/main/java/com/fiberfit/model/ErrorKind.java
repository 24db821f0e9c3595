package com.fiberfit.model;

/**
 * User-facing failure categories of a single file. Every analysis failure ends up in
 * exactly one of them.
 */
public enum ErrorKind {

    UNSUPPORTED_IMAGE(true,
            "ERROR:\nSorry, unfortunately, this file - %s can not be processed.\n"
            + "Please make sure that the image has 8-bit image depth, or, equivalently, gray color space, "
            + "and verify that you are using one of the approved file formats: png, tif, gif, bmp, jpg or fits."),

    SETTINGS_OUT_OF_DOMAIN(false,
            "ERROR:\nSorry, unfortunately, the settings you selected are out of input domain for FiberFit.\n"
            + "Please go back to \"Settings\" and change some values."),

    IMAGE_SHAPE_OR_OTHER(true,
            "ERROR:\nSorry, unfortunately, this file - %s can not be processed.\n"
            + "Please make sure that the image is square.");

    private final boolean namesFile;
    private final String template;

    ErrorKind(boolean namesFile, String template) {
        this.namesFile = namesFile;
        this.template = template;
    }

    public boolean namesFile() {
        return namesFile;
    }

    public String message(String fileName) {
        return namesFile ? String.format(template, fileName) : template;
    }
}
