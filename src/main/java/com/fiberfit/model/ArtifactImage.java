package com.fiberfit.model;

import java.awt.image.BufferedImage;

/**
 * A rendered artifact in both forms: the raster for display and the base64 text of
 * its PNG bytes for transport or export.
 */
public record ArtifactImage(BufferedImage raster, String base64) {
}
