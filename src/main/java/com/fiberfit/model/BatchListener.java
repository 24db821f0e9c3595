package com.fiberfit.model;

/**
 * Consumer side of the batch notifications. All methods default to no-ops.
 */
public interface BatchListener {

    default void onStarted(BatchEvent.Started event) {}

    default void onItemProcessed(BatchEvent.ItemProcessed event) {}

    default void onItemFailed(BatchEvent.ItemFailed event) {}

    default void onCompleted(BatchEvent.Completed event) {}
}
