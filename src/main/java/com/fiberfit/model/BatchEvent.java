package com.fiberfit.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Messages sent from the batch worker to the consumer, in the order the files were listed.
 */
public interface BatchEvent {

    void deliverTo(BatchListener listener);

    record Started(int total) implements BatchEvent {
        @Override public void deliverTo(BatchListener l) { l.onStarted(this); }
    }

    /**
     * @param processedCount successes so far in this batch
     * @param last           true when this was the final file of the list
     */
    record ItemProcessed(int processedCount,
                         ProcessedResult result,
                         List<ProcessedResult> resultsSoFar,
                         boolean last,
                         double elapsedSeconds,
                         int nextSequenceNumber) implements BatchEvent {
        public ItemProcessed {
            resultsSoFar = List.copyOf(resultsSoFar);
        }
        @Override public void deliverTo(BatchListener l) { l.onItemProcessed(this); }
    }

    /**
     * @param fileIndex position of the failed file in {@code files}
     */
    record ItemFailed(List<Path> files,
                      int processedCount,
                      ErrorKind kind,
                      int fileIndex,
                      String detail) implements BatchEvent {
        public ItemFailed {
            files = List.copyOf(files);
        }
        public Path file() { return files.get(fileIndex); }
        public String message() { return kind.message(file().getFileName().toString()); }
        @Override public void deliverTo(BatchListener l) { l.onItemFailed(this); }
    }

    record Completed(int processedCount, int failedCount, boolean lastSucceeded) implements BatchEvent {
        @Override public void deliverTo(BatchListener l) { l.onCompleted(this); }
    }
}
