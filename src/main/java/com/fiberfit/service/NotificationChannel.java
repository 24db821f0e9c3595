package com.fiberfit.service;

import com.fiberfit.model.BatchEvent;
import com.fiberfit.model.BatchListener;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded hand-off of {@link BatchEvent}s from the worker thread to a single consumer.
 * <p>
 * The worker {@link #publish(BatchEvent) publishes}; the consumer executor drains the queue
 * and delivers every event to the listener in publication order. With
 * {@code Platform::runLater} as executor all events are handled on the FX thread.
 */
public class NotificationChannel {

    public static final int DEFAULT_CAPACITY = 64;

    private final BlockingQueue<BatchEvent> queue;
    private final Executor consumerExecutor;
    private final BatchListener listener;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    public NotificationChannel(Executor consumerExecutor, BatchListener listener) {
        this(DEFAULT_CAPACITY, consumerExecutor, listener);
    }

    public NotificationChannel(int capacity, Executor consumerExecutor, BatchListener listener) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.consumerExecutor = consumerExecutor;
        this.listener = listener;
    }

    /**
     * Queues an event, blocking while the queue is full, and makes sure a drain is scheduled.
     */
    public void publish(BatchEvent event) throws InterruptedException {
        queue.put(event);
        if (drainScheduled.compareAndSet(false, true)) {
            consumerExecutor.execute(() -> {
                drainScheduled.set(false);
                drain();
            });
        }
    }

    /**
     * Delivers every queued event. Must only be called from the consumer side.
     *
     * @return number of events delivered
     */
    public int drain() {
        int n = 0;
        BatchEvent event;
        while ((event = queue.poll()) != null) {
            event.deliverTo(listener);
            n++;
        }
        return n;
    }

    public int pending() {
        return queue.size();
    }
}
