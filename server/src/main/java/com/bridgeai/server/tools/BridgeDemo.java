package com.bridgeai.server.tools;

import com.bridgeai.server.ai.AiBuffer;
import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.Prediction;
import com.bridgeai.server.ai.RequestType;
import com.bridgeai.server.bridge.BridgeConfig;
import com.bridgeai.server.bridge.BridgeMode;
import com.bridgeai.server.bridge.BridgeStats;
import com.bridgeai.server.bridge.ChipsetType;
import com.bridgeai.server.bridge.DeviceContext;
import com.bridgeai.server.bridge.KernelBridge;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.util.DataPathResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Offline walkthrough of the bridge with simulated devices.
 * Usage: BridgeDemo [requestCount]
 */
public class BridgeDemo {

    private static final Logger logger = LoggerFactory.getLogger(BridgeDemo.class);

    private static final int[] DEVICE_IDS = { 0x8086, 0x1022, 0x10DE, 0x17CB };
    private static final ChipsetType[] CHIPSETS = {
            ChipsetType.INTEL, ChipsetType.AMD, ChipsetType.NVIDIA, ChipsetType.QUALCOMM };

    public static void main(String[] args) {
        int requestCount = 200;
        if (args.length > 0) {
            try {
                requestCount = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                System.err.println("Usage: BridgeDemo [requestCount]");
                System.exit(1);
            }
        }

        BridgeConfig config;
        try {
            config = BridgeConfig.load(new ObjectMapper());
        } catch (IOException e) {
            logger.error("Failed to read bridge config", e);
            System.exit(1);
            return;
        }
        // feedback is only recorded in learning mode
        config.mode = BridgeMode.LEARNING;

        KernelBridge bridge = new KernelBridge(config);
        bridge.init();
        try {
            run(bridge, requestCount);
            Path modelPath = Paths.get(DataPathResolver.resolveModelPath(config));
            bridge.saveModel(modelPath);
            logger.info("Model saved to {}", modelPath.toAbsolutePath());
        } catch (BridgeException e) {
            logger.error("Demo failed: {}", e.toString(), e);
        } finally {
            bridge.shutdown();
        }
    }

    static void run(KernelBridge bridge, int requestCount) {
        Random rnd = new Random(42);
        List<DeviceContext> devices = new ArrayList<>();
        for (int i = 0; i < DEVICE_IDS.length; i++) {
            devices.add(bridge.registerDevice(DEVICE_IDS[i], CHIPSETS[i], null, null));
        }

        AiBuffer ai = bridge.getAiBuffer();
        RequestType[] types = RequestType.values();
        for (int i = 0; i < requestCount; i++) {
            DeviceContext device = devices.get(rnd.nextInt(devices.size()));
            RequestType type = types[rnd.nextInt(types.length)];
            CommRequest request = CommRequest.of(type, device.getDeviceId(), rnd.nextInt(0x10000),
                    1 + rnd.nextInt(8192), 0, rnd.nextInt(CommRequest.MAX_PRIORITY + 1));

            try {
                bridge.enqueueRequest(device, request);
            } catch (BridgeException e) {
                logger.warn("Enqueue rejected: {}", e.getMessage());
                continue;
            }

            Prediction prediction = ai.processRequest(request);
            int latency = prediction.getEstimatedLatencyUs() + rnd.nextInt(200);
            bridge.submitFeedback(request, prediction, latency, rnd.nextInt(10) < 8);
            bridge.sendResponse(device, (int) request.getSize());
        }

        CommRequest probe = CommRequest.of(RequestType.IO_READ, DEVICE_IDS[0], 0x1000, 10, 0, 5);
        logger.info("Optimized IO_READ size 10 -> {}", ai.optimizeRequest(probe).getSize());
        logger.info("IO_READ failure probability {}", String.format("%.3f", ai.predictFailure(probe)));

        waitForDrain(bridge);
        BridgeStats stats = bridge.getStats();
        logger.info("Bridge statistics: {}", stats);
        logger.info("History index {}", ai.getHistoryIndex());

        for (DeviceContext device : devices) {
            bridge.unregisterDevice(device);
        }
    }

    private static void waitForDrain(KernelBridge bridge) {
        long deadline = System.currentTimeMillis() + 2000;
        while (bridge.getQueueDepth() > 0 && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
