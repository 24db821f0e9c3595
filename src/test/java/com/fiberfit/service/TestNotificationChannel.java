package com.fiberfit.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.fiberfit.model.BatchEvent;

public class TestNotificationChannel {

    @Test
    public void test_eventsArriveInOrderOnConsumerThread() throws Exception {
        ExecutorService consumer = Executors.newSingleThreadExecutor(r -> new Thread(r, "consumer"));
        var listener = new RecordingListener();
        var channel = new NotificationChannel(4, consumer, listener);

        Thread producer = new Thread(() -> {
            try {
                channel.publish(new BatchEvent.Started(100));
                for (int i = 1; i <= 100; i++)
                    channel.publish(new BatchEvent.Completed(i, 0, true));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "producer");
        producer.start();
        producer.join(10_000);

        consumer.shutdown();
        assertTrue(consumer.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(101, listener.events.size());
        assertEquals(new BatchEvent.Started(100), listener.events.get(0));
        List<Integer> counts = new ArrayList<>();
        for (var c : listener.ofType(BatchEvent.Completed.class)) counts.add(c.processedCount());
        for (int i = 0; i < counts.size(); i++) assertEquals(i + 1, counts.get(i));
        assertTrue(listener.threads.stream().allMatch("consumer"::equals));
    }

    @Test
    public void test_manualDrainDeliversPending() throws Exception {
        List<Runnable> scheduled = new ArrayList<>();
        var listener = new RecordingListener();
        var channel = new NotificationChannel(scheduled::add, listener);

        channel.publish(new BatchEvent.Started(2));
        channel.publish(new BatchEvent.Completed(2, 0, true));
        assertEquals(1, scheduled.size(), "one drain is enough for a burst");
        assertEquals(2, channel.pending());

        assertEquals(2, channel.drain());
        assertEquals(0, channel.pending());
        assertEquals(2, listener.events.size());

        // the scheduled drain still runs but finds nothing
        scheduled.get(0).run();
        assertEquals(2, listener.events.size());
    }
}
