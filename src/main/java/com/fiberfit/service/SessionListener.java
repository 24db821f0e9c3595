package com.fiberfit.service;

import com.fiberfit.model.BatchEvent;
import com.fiberfit.model.ProcessedResult;

/**
 * Presentation callbacks of a {@link FiberFitSession}. Called on the consumer thread after
 * the session state was updated.
 */
public interface SessionListener {

    default void onBatchStarted(int total) {}

    default void onProgress(int processed, int total) {}

    default void onResultSelected(ProcessedResult result, int index) {}

    default void onFailure(BatchEvent.ItemFailed failure) {}

    default void onBatchFinished(BatchEvent.Completed completed) {}

    default void onCleared() {}
}
