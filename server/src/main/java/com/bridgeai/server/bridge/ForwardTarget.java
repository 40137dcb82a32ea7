package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.CommRequest;

/**
 * Downstream collaborator that receives requests once the worker has routed
 * them.
 */
public interface ForwardTarget {

    /**
     * @return true when the target acknowledged the request
     */
    boolean forward(DeviceContext context, CommRequest request);
}
