package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.AiBuffer;
import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.FeatureExtractor;
import com.bridgeai.server.ai.RequestType;
import com.bridgeai.server.ai.store.ModelStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class BatchWorkerTest {

    private RequestQueue queue;
    private BridgeCounters counters;
    private AiBuffer ai;
    private List<CommRequest> forwarded;
    private DeviceContext device;

    @BeforeEach
    public void setup() {
        queue = new RequestQueue(8);
        counters = new BridgeCounters();
        ai = new AiBuffer(new FeatureExtractor(), new ModelStore(), new Random(1));
        forwarded = new ArrayList<>();
        device = new DeviceContext(0x10DE, ChipsetType.NVIDIA, null, null, true);
    }

    private BatchWorker worker(boolean aiActive, ForwardTarget target) {
        return new BatchWorker(queue, ai, () -> aiActive, target, counters, 10);
    }

    private ForwardTarget recorder() {
        return (ctx, req) -> {
            forwarded.add(req);
            return true;
        };
    }

    private static CommRequest request(long address) {
        return CommRequest.of(RequestType.IO_WRITE, 0x10DE, address, 128, 0, 3);
    }

    @Test
    public void testCycleDrainsAndForwardsInOrder() {
        ai.init(false);
        BatchWorker worker = worker(true, recorder());
        for (int i = 0; i < 3; i++) {
            queue.enqueue(new QueueEntry(request(i), device));
        }

        Assertions.assertTrue(worker.runCycle());
        Assertions.assertEquals(0, queue.size());
        Assertions.assertEquals(3, forwarded.size());
        for (int i = 0; i < 3; i++) {
            Assertions.assertEquals(i, forwarded.get(i).getAddress());
        }
        Assertions.assertEquals(3, counters.getForwardedToKernel());
        Assertions.assertEquals(3, counters.getAiOptimized());
        Assertions.assertEquals(3, ai.getStats().getRequestsProcessed());
        Assertions.assertEquals(WorkerState.IDLE, worker.getState());
    }

    @Test
    public void testTimeoutWakeStillDrains() {
        BatchWorker worker = worker(false, recorder());
        Assertions.assertTrue(worker.runCycle());
        Assertions.assertEquals(1, worker.getCycles());
        Assertions.assertEquals(0, counters.getForwardedToKernel());
    }

    @Test
    public void testPassthroughSkipsModel() {
        BatchWorker worker = worker(false, recorder());
        queue.enqueue(new QueueEntry(request(1), device));
        worker.drain();
        Assertions.assertEquals(1, counters.getForwardedToKernel());
        Assertions.assertEquals(0, counters.getAiOptimized());
    }

    @Test
    public void testPredictionFailureDoesNotAbortBatch() {
        // model never initialized, so every prediction fails
        BatchWorker worker = worker(true, recorder());
        queue.enqueue(new QueueEntry(request(1), device));
        queue.enqueue(new QueueEntry(request(2), device));

        Assertions.assertEquals(2, worker.drain());
        Assertions.assertEquals(2, counters.getFailures());
        Assertions.assertEquals(2, counters.getForwardedToKernel());
        Assertions.assertEquals(0, counters.getAiOptimized());
    }

    @Test
    public void testUnexpectedPredictionErrorIsCountedAndBatchContinues() {
        AiBuffer failing = new AiBuffer(new FeatureExtractor(() -> {
            throw new IllegalStateException("clock unavailable");
        }), new ModelStore(), new Random(1));
        failing.init(false);
        BatchWorker worker = new BatchWorker(queue, failing, () -> true, recorder(), counters, 10);
        queue.enqueue(new QueueEntry(request(1), device));
        queue.enqueue(new QueueEntry(request(2), device));

        Assertions.assertTrue(worker.runCycle());
        Assertions.assertEquals(WorkerState.IDLE, worker.getState());
        Assertions.assertEquals(2, forwarded.size());
        Assertions.assertEquals(2, counters.getFailures());
        Assertions.assertEquals(2, counters.getForwardedToKernel());
        Assertions.assertEquals(0, counters.getAiOptimized());

        queue.enqueue(new QueueEntry(request(3), device));
        Assertions.assertTrue(worker.runCycle());
        Assertions.assertEquals(0, queue.size());
        Assertions.assertEquals(3, counters.getFailures());
    }

    @Test
    public void testNackIsStillCountedAsForwarded() {
        BatchWorker worker = worker(false, (ctx, req) -> false);
        queue.enqueue(new QueueEntry(request(1), device));
        worker.drain();
        Assertions.assertEquals(1, counters.getForwardedToKernel());
    }

    @Test
    public void testUnregisteredDeviceIsDropped() {
        DeviceRegistry registry = new DeviceRegistry(4);
        registry.register(device);
        queue.enqueue(new QueueEntry(request(1), device));
        registry.unregister(device);

        BatchWorker worker = worker(false, recorder());
        worker.drain();
        Assertions.assertTrue(forwarded.isEmpty());
        Assertions.assertEquals(1, counters.getFailures());
        Assertions.assertEquals(0, counters.getForwardedToKernel());
    }

    @Test
    public void testArrivalsDuringDrainWaitForNextCycle() {
        ForwardTarget enqueueing = (ctx, req) -> {
            forwarded.add(req);
            if (req.getAddress() == 1) {
                queue.enqueue(new QueueEntry(request(99), device));
            }
            return true;
        };
        BatchWorker worker = worker(false, enqueueing);
        queue.enqueue(new QueueEntry(request(1), device));
        queue.enqueue(new QueueEntry(request(2), device));

        Assertions.assertEquals(2, worker.drain());
        Assertions.assertEquals(1, queue.size());
        Assertions.assertEquals(1, worker.drain());
        Assertions.assertEquals(99, forwarded.get(2).getAddress());
    }

    @Test
    public void testStopIsObservedAtTopOfCycle() {
        BatchWorker worker = worker(false, recorder());
        queue.enqueue(new QueueEntry(request(1), device));
        worker.requestStop();

        Assertions.assertFalse(worker.runCycle());
        Assertions.assertEquals(WorkerState.STOPPED, worker.getState());
        Assertions.assertEquals(1, queue.size());
    }
}
