package com.fiberfit.service;

import com.fiberfit.model.AnalysisOutput;
import com.fiberfit.model.AnalysisRequest;

/**
 * The heavy image analysis run once per file by the batch worker. Implementations are
 * called from the worker thread only and must not write the final artifacts themselves.
 */
public interface AnalysisAdapter {

    /**
     * @throws UnsupportedImageException if the file cannot be decoded or has the wrong depth
     * @throws NonSquareImageException if the image is not square
     * @throws ArithmeticException if the settings are out of the valid domain for this data
     */
    AnalysisOutput analyze(AnalysisRequest request) throws Exception;
}
