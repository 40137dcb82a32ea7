package com.bridgeai.server.controller;

import com.bridgeai.db.ModelSnapshot;
import com.bridgeai.server.ai.BatchPlan;
import com.bridgeai.server.ai.CommRequest;
import com.bridgeai.server.ai.Decision;
import com.bridgeai.server.ai.Prediction;
import com.bridgeai.server.ai.RequestType;
import com.bridgeai.server.bridge.BridgeMode;
import com.bridgeai.server.bridge.BridgeStats;
import com.bridgeai.server.bridge.ChipsetType;
import com.bridgeai.server.bridge.DeviceContext;
import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;
import com.bridgeai.server.portforward.ForwardRule;
import com.bridgeai.server.portforward.PortForwardStats;
import com.bridgeai.server.service.BridgeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class BridgeController {

    private static final Logger logger = LoggerFactory.getLogger(BridgeController.class);
    private final BridgeService bridgeService;

    public BridgeController(BridgeService bridgeService) {
        this.bridgeService = bridgeService;
    }

    public static class DeviceRegistration {
        public Integer deviceId;
        public ChipsetType chipsetType;
    }

    public static class DeviceInfo {
        public int deviceId;
        public ChipsetType chipsetType;
        public boolean aiManaged;
        public int activeRequests;

        static DeviceInfo of(DeviceContext ctx) {
            DeviceInfo info = new DeviceInfo();
            info.deviceId = ctx.getDeviceId();
            info.chipsetType = ctx.getChipsetType();
            info.aiManaged = ctx.isAiManaged();
            info.activeRequests = ctx.getActiveRequests();
            return info;
        }
    }

    public static class RequestPayload {
        public RequestType type;
        public int deviceId;
        public long address;
        public long size;
        public byte[] data;
        public int flags;
        public int priority;

        CommRequest toCommRequest() {
            if (type == null) {
                throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Request type is required");
            }
            return new CommRequest(type, deviceId, address, size, data, flags, System.nanoTime(), priority);
        }
    }

    public static class ResponsePayload {
        public int payloadSize;
    }

    public static class FeedbackBody {
        public RequestPayload request;
        public Decision decision;
        public int latencyUs;
        public boolean success;
    }

    public static class ModeBody {
        public BridgeMode mode;
    }

    public static class BatchBody {
        public List<RequestPayload> requests;
    }

    // --- devices ---

    @PostMapping("/devices")
    public ResponseEntity<DeviceInfo> registerDevice(@RequestBody DeviceRegistration body) {
        if (body == null || body.deviceId == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "deviceId is required");
        }
        DeviceContext ctx = bridgeService.registerDevice(body.deviceId, body.chipsetType);
        return ResponseEntity.status(HttpStatus.CREATED).body(DeviceInfo.of(ctx));
    }

    @DeleteMapping("/devices/{id}")
    public ResponseEntity<Void> unregisterDevice(@PathVariable("id") int id) {
        bridgeService.unregisterDevice(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/devices")
    public List<DeviceInfo> listDevices() {
        List<DeviceInfo> out = new ArrayList<>();
        for (DeviceContext ctx : bridgeService.listDevices()) {
            out.add(DeviceInfo.of(ctx));
        }
        return out;
    }

    @PostMapping("/devices/{id}/requests")
    public ResponseEntity<Map<String, Object>> enqueue(@PathVariable("id") int id,
            @RequestBody RequestPayload body) {
        body.deviceId = id;
        bridgeService.enqueue(id, body.toCommRequest());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("deviceId", id, "queued", true));
    }

    @PostMapping("/devices/{id}/responses")
    public ResponseEntity<Void> respond(@PathVariable("id") int id,
            @RequestBody ResponsePayload body) {
        bridgeService.respond(id, body.payloadSize);
        return ResponseEntity.noContent().build();
    }

    // --- decisions ---

    @PostMapping("/requests/predict")
    public Prediction predict(@RequestBody RequestPayload body) {
        return bridgeService.predict(body.toCommRequest());
    }

    @PostMapping("/requests/optimize")
    public CommRequest optimize(@RequestBody RequestPayload body) {
        return bridgeService.optimize(body.toCommRequest());
    }

    @PostMapping("/requests/failure-probability")
    public Map<String, Object> failureProbability(@RequestBody RequestPayload body) {
        CommRequest request = body.toCommRequest();
        return Map.of("type", request.getType(), "probability", bridgeService.failureProbability(request));
    }

    @PostMapping("/requests/batch-plan")
    public BatchPlan batchPlan(@RequestBody BatchBody body) {
        if (body == null || body.requests == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "requests is required");
        }
        List<CommRequest> requests = new ArrayList<>(body.requests.size());
        for (RequestPayload r : body.requests) {
            requests.add(r.toCommRequest());
        }
        return bridgeService.batchPlan(requests);
    }

    @PostMapping("/feedback")
    public ResponseEntity<Void> feedback(@RequestBody FeedbackBody body) {
        if (body == null || body.request == null || body.decision == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "request and decision are required");
        }
        // only the decision of a prediction is recorded
        Prediction prediction = new Prediction(body.decision, 0.0f, 0, false, 0);
        bridgeService.feedback(body.request.toCommRequest(), prediction, body.latencyUs, body.success);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public BridgeStats stats() {
        return bridgeService.getStats();
    }

    @PutMapping("/mode")
    public Map<String, Object> setMode(@RequestBody ModeBody body) {
        if (body == null || body.mode == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "mode is required");
        }
        bridgeService.setMode(body.mode);
        logger.info("Mode changed via API to {}", body.mode);
        return Map.of("mode", bridgeService.getMode());
    }

    // --- model persistence ---

    @PostMapping("/model/save")
    public Map<String, Object> saveModel() {
        return Map.of("path", bridgeService.saveModel().toString());
    }

    @PostMapping("/model/load")
    public Map<String, Object> loadModel() {
        return Map.of("path", bridgeService.loadModel().toString());
    }

    @PostMapping("/model/snapshots/{name}")
    public ResponseEntity<ModelSnapshot> saveSnapshot(@PathVariable("name") String name) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bridgeService.saveSnapshot(name));
    }

    @PostMapping("/model/snapshots/{name}/restore")
    public ResponseEntity<Void> restoreSnapshot(@PathVariable("name") String name) {
        bridgeService.restoreSnapshot(name);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/model/snapshots")
    public List<ModelSnapshot> listSnapshots() {
        return bridgeService.listSnapshots();
    }

    @DeleteMapping("/model/snapshots/{name}")
    public ResponseEntity<Void> deleteSnapshot(@PathVariable("name") String name) {
        bridgeService.deleteSnapshot(name);
        return ResponseEntity.noContent().build();
    }

    // --- port forwarding ---

    @PostMapping("/port-forward/rules")
    public ResponseEntity<ForwardRule> addRule(@RequestBody ForwardRule rule) {
        int id = bridgeService.getPortForward().addRule(rule);
        return ResponseEntity.status(HttpStatus.CREATED).body(bridgeService.getPortForward().getRule(id));
    }

    @GetMapping("/port-forward/rules")
    public List<ForwardRule> listRules(@RequestParam(value = "max", defaultValue = "1024") int max) {
        return bridgeService.getPortForward().listRules(max);
    }

    @GetMapping("/port-forward/rules/{id}")
    public ForwardRule getRule(@PathVariable("id") int id) {
        return bridgeService.getPortForward().getRule(id);
    }

    @PutMapping("/port-forward/rules/{id}")
    public ForwardRule updateRule(@PathVariable("id") int id,
            @RequestBody ForwardRule rule) {
        bridgeService.getPortForward().updateRule(id, rule);
        return bridgeService.getPortForward().getRule(id);
    }

    @DeleteMapping("/port-forward/rules/{id}")
    public ResponseEntity<Void> removeRule(@PathVariable("id") int id) {
        bridgeService.getPortForward().removeRule(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/port-forward/rules/{id}/enable")
    public ForwardRule enableRule(@PathVariable("id") int id) {
        bridgeService.getPortForward().enableRule(id);
        return bridgeService.getPortForward().getRule(id);
    }

    @PostMapping("/port-forward/rules/{id}/disable")
    public ForwardRule disableRule(@PathVariable("id") int id) {
        bridgeService.getPortForward().disableRule(id);
        return bridgeService.getPortForward().getRule(id);
    }

    @GetMapping("/port-forward/stats")
    public PortForwardStats portForwardStats() {
        return bridgeService.getPortForward().getStats();
    }

    @PostMapping("/port-forward/stats/reset")
    public ResponseEntity<Void> resetPortForwardStats() {
        bridgeService.getPortForward().resetStats();
        return ResponseEntity.noContent().build();
    }
}
