package com.bridgeai.server.bridge;

import com.bridgeai.server.ai.CommRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated kernel side: logs the request and acknowledges it.
 */
public class LoggingForwardTarget implements ForwardTarget {
    private static final Logger logger = LoggerFactory.getLogger(LoggingForwardTarget.class);

    @Override
    public boolean forward(DeviceContext context, CommRequest request) {
        logger.debug("Forward {} request to kernel for device 0x{}", request.getType(),
                Integer.toHexString(context.getDeviceId()));
        return true;
    }
}
