package com.bridgeai.server.controller;

import com.bridgeai.server.bridge.BridgeConfig;
import com.bridgeai.server.bridge.BridgeMode;
import com.bridgeai.server.service.BridgeService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class BridgeControllerTest {

    @TempDir
    Path tempDir;

    private BridgeService service;
    private MockMvc mvc;

    @BeforeEach
    public void setup() {
        BridgeConfig config = BridgeConfig.defaults();
        config.dataDirectory = tempDir.toString();
        config.mode = BridgeMode.LEARNING;
        service = new BridgeService(config);
        service.init();
        mvc = MockMvcBuilders.standaloneSetup(new BridgeController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    public void teardown() {
        service.shutdown();
    }

    private static String request(String type, int deviceId, int size) {
        return "{\"type\":\"" + type + "\",\"deviceId\":" + deviceId + ",\"address\":4096,\"size\":" + size +
                ",\"flags\":0,\"priority\":5}";
    }

    @Test
    public void testDeviceLifecycle() throws Exception {
        mvc.perform(post("/v1/devices").contentType(MediaType.APPLICATION_JSON)
                .content("{\"deviceId\":32902,\"chipsetType\":\"INTEL\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.deviceId").value(32902))
                .andExpect(jsonPath("$.chipsetType").value("INTEL"))
                .andExpect(jsonPath("$.aiManaged").value(true));

        mvc.perform(post("/v1/devices").contentType(MediaType.APPLICATION_JSON)
                .content("{\"deviceId\":32902}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mvc.perform(get("/v1/devices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].deviceId").value(32902));

        mvc.perform(post("/v1/devices/32902/requests").contentType(MediaType.APPLICATION_JSON)
                .content(request("IO_READ", 0, 64)))
                .andExpect(status().isAccepted());

        mvc.perform(post("/v1/devices/32902/responses").contentType(MediaType.APPLICATION_JSON)
                .content("{\"payloadSize\":64}"))
                .andExpect(status().isNoContent());

        mvc.perform(delete("/v1/devices/32902"))
                .andExpect(status().isNoContent());

        mvc.perform(delete("/v1/devices/32902"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    public void testEnqueueForUnknownDevice() throws Exception {
        mvc.perform(post("/v1/devices/77/requests").contentType(MediaType.APPLICATION_JSON)
                .content(request("IO_WRITE", 77, 16)))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testInvalidPriorityIsBadRequest() throws Exception {
        mvc.perform(post("/v1/requests/optimize").contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"IO_READ\",\"deviceId\":1,\"size\":10,\"priority\":11}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    public void testLargeSizesAreAlignedUpOrRejected() throws Exception {
        mvc.perform(post("/v1/requests/optimize").contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"DMA_ALLOC\",\"deviceId\":1,\"size\":2147483000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(2147483648L));

        mvc.perform(post("/v1/requests/optimize").contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"DMA_ALLOC\",\"deviceId\":1,\"size\":4294967000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    public void testDecisionEndpoints() throws Exception {
        mvc.perform(post("/v1/requests/optimize").contentType(MediaType.APPLICATION_JSON)
                .content(request("IO_READ", 1, 10)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(64));

        mvc.perform(post("/v1/requests/failure-probability").contentType(MediaType.APPLICATION_JSON)
                .content(request("DMA_ALLOC", 1, 10)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.probability").value(0.5));

        mvc.perform(post("/v1/requests/batch-plan").contentType(MediaType.APPLICATION_JSON)
                .content("{\"requests\":[" + request("IO_READ", 1, 8) + "," + request("IO_WRITE", 1, 8) + ","
                        + request("IO_READ", 1, 512) + "]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupIds[0]").value(0))
                .andExpect(jsonPath("$.groupIds[1]").value(1))
                .andExpect(jsonPath("$.groupIds[2]").value(0))
                .andExpect(jsonPath("$.groupCount").value(2));

        mvc.perform(post("/v1/requests/predict").contentType(MediaType.APPLICATION_JSON)
                .content(request("PCI_CONFIG", 1, 4)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").exists());
    }

    @Test
    public void testFeedbackShowsInStats() throws Exception {
        String feedback = "{\"request\":" + request("IO_READ", 1, 64) +
                ",\"decision\":\"BUFFER\",\"latencyUs\":250,\"success\":true}";
        mvc.perform(post("/v1/feedback").contentType(MediaType.APPLICATION_JSON).content(feedback))
                .andExpect(status().isNoContent());

        mvc.perform(get("/v1/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aiAccuracy").value(1.0))
                .andExpect(jsonPath("$.avgLatencyUs").value(250))
                .andExpect(jsonPath("$.totalRequests").value(0));
    }

    @Test
    public void testModeChange() throws Exception {
        mvc.perform(put("/v1/mode").contentType(MediaType.APPLICATION_JSON).content("{\"mode\":\"PASSTHROUGH\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("PASSTHROUGH"));
    }

    @Test
    public void testModelFileAndSnapshots() throws Exception {
        mvc.perform(post("/v1/model/save"))
                .andExpect(status().isOk());
        assertTrue(Files.exists(tempDir.resolve("bridge_model.bin")));

        mvc.perform(post("/v1/model/load"))
                .andExpect(status().isOk());

        mvc.perform(post("/v1/model/snapshots/baseline"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("baseline"))
                .andExpect(jsonPath("$.sizeBytes").value(13213));

        mvc.perform(get("/v1/model/snapshots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("baseline"));

        mvc.perform(post("/v1/model/snapshots/baseline/restore"))
                .andExpect(status().isNoContent());

        mvc.perform(post("/v1/model/snapshots/missing/restore"))
                .andExpect(status().isNotFound());

        mvc.perform(delete("/v1/model/snapshots/baseline"))
                .andExpect(status().isNoContent());
    }

    @Test
    public void testPortForwardRules() throws Exception {
        String rule = "{\"name\":\"web\",\"srcPort\":8080,\"dstAddr\":\"10.0.0.2\",\"dstPort\":80," +
                "\"protocol\":\"TCP\",\"flags\":1,\"driverId\":1}";
        mvc.perform(post("/v1/port-forward/rules").contentType(MediaType.APPLICATION_JSON).content(rule))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.enabled").value(true));

        mvc.perform(post("/v1/port-forward/rules/1/disable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flags").value(0));

        mvc.perform(get("/v1/port-forward/rules/9"))
                .andExpect(status().isNotFound());

        mvc.perform(get("/v1/port-forward/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRules").value(1));

        mvc.perform(delete("/v1/port-forward/rules/1"))
                .andExpect(status().isNoContent());
    }
}
