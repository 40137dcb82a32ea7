package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.RequestType;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

public class RequestQueueTest {

    private static final DeviceContext DEVICE = new DeviceContext(1, ChipsetType.INTEL, null, null, true);

    private static QueueEntry entry(int address) {
        return new QueueEntry(CommRequest.of(RequestType.IO_READ, 1, address, 64, 0, 0), DEVICE);
    }

    @Test
    public void testFullQueueRejects() {
        RequestQueue queue = new RequestQueue(2);
        queue.enqueue(entry(1));
        queue.enqueue(entry(2));
        BridgeException ex = Assertions.assertThrows(BridgeException.class, () -> queue.enqueue(entry(3)));
        Assertions.assertEquals(ErrorCode.CAPACITY_EXCEEDED, ex.getCode());
        Assertions.assertEquals(2, queue.size());
    }

    @Test
    public void testDrainIsFifoAcrossWrap() {
        RequestQueue queue = new RequestQueue(3);
        queue.enqueue(entry(1));
        queue.enqueue(entry(2));
        Assertions.assertEquals(2, queue.drainBatch().size());

        queue.enqueue(entry(3));
        queue.enqueue(entry(4));
        queue.enqueue(entry(5));
        List<QueueEntry> batch = queue.drainBatch();
        Assertions.assertEquals(3, batch.size());
        Assertions.assertEquals(3L, batch.get(0).getRequest().getAddress());
        Assertions.assertEquals(4L, batch.get(1).getRequest().getAddress());
        Assertions.assertEquals(5L, batch.get(2).getRequest().getAddress());
        Assertions.assertTrue(queue.isEmpty());
        Assertions.assertTrue(queue.drainBatch().isEmpty());
    }

    @Test
    public void testAwaitReturnsAtOnceWhenWorkQueued() throws InterruptedException {
        RequestQueue queue = new RequestQueue(4);
        queue.enqueue(entry(1));
        Assertions.assertEquals(RequestQueue.Wake.SIGNALED,
                queue.awaitWork(TimeUnit.SECONDS.toNanos(30), () -> false));
    }

    @Test
    public void testAwaitTimesOutOnEmptyQueue() throws InterruptedException {
        RequestQueue queue = new RequestQueue(4);
        Assertions.assertEquals(RequestQueue.Wake.TIMED_OUT,
                queue.awaitWork(TimeUnit.MILLISECONDS.toNanos(5), () -> false));
    }

    @Test
    public void testEnqueueWakesWaitingConsumer() throws Exception {
        RequestQueue queue = new RequestQueue(4);
        Thread producer = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            queue.enqueue(entry(1));
        });
        long start = System.nanoTime();
        producer.start();
        RequestQueue.Wake wake = queue.awaitWork(TimeUnit.SECONDS.toNanos(30), () -> false);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        producer.join();

        Assertions.assertEquals(RequestQueue.Wake.SIGNALED, wake);
        Assertions.assertTrue(elapsedMs < 10_000, "consumer waited " + elapsedMs + " ms");
        Assertions.assertEquals(1, queue.size());
    }

    @Test
    public void testInvalidCapacity() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RequestQueue(0));
    }
}
