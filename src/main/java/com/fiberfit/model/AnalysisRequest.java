package com.fiberfit.model;

import java.nio.file.Path;

/**
 * Input of one analysis call. {@code outputDirectory} and {@code sequenceNumber} describe
 * where the artifacts of a success will end up; adapters may use them for scratch files
 * but must not write the final artifacts themselves.
 */
public record AnalysisRequest(Path file,
                              AnalysisSettings settings,
                              DisplayGeometry geometry,
                              Path outputDirectory,
                              int sequenceNumber) {
}
