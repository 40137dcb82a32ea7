package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.CommRequest;

public class QueueEntry {
    private final CommRequest request;
    private final DeviceContext context;

    public QueueEntry(CommRequest request, DeviceContext context) {
        if (request == null || context == null) {
            throw new IllegalArgumentException("Queue entry needs a request and a device context");
        }
        this.request = request;
        this.context = context;
    }

    public CommRequest getRequest() {
        return request;
    }

    public DeviceContext getContext() {
        return context;
    }
}
