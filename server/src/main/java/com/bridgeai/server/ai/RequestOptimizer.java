package com.bridgeai.server.ai;

import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;

import java.util.List;

/**
 * Model-free request transforms: size alignment and batch grouping.
 */
public class RequestOptimizer {
    static final int CACHE_LINE = 64;
    static final int PAGE = 4096;

    /**
     * Aligns read/write sizes up to a cache line (minimum one line) and DMA
     * allocations up to a page. Other request types are returned unchanged.
     * A size whose aligned value would not fit in 32 bits is rejected with
     * {@link ErrorCode#INVALID_ARGUMENT}; the result is never smaller than the input.
     */
    public static CommRequest optimize(CommRequest request) {
        switch (request.getType()) {
            case IO_READ:
            case IO_WRITE:
                if (request.getSize() < CACHE_LINE) {
                    return request.withSize(CACHE_LINE);
                }
                return request.withSize(alignUp(request.getSize(), CACHE_LINE));
            case DMA_ALLOC:
                return request.withSize(alignUp(request.getSize(), PAGE));
            default:
                return request;
        }
    }

    static long alignUp(long size, int alignment) {
        long aligned = (size + alignment - 1) & ~((long) alignment - 1);
        if (aligned > CommRequest.MAX_SIZE) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT,
                    "Size " + size + " cannot be aligned to " + alignment + " within 32 bits");
        }
        return aligned;
    }

    /**
     * Groups requests by exact (type, device id). Group ids are handed out in
     * first-seen order.
     */
    public static BatchPlan planBatches(List<CommRequest> requests) {
        int n = requests.size();
        int[] groups = new int[n];
        int groupCount = 0;

        for (int i = 0; i < n; i++) {
            CommRequest current = requests.get(i);
            boolean found = false;
            for (int j = 0; j < i; j++) {
                CommRequest earlier = requests.get(j);
                if (current.getType() == earlier.getType() && current.getDeviceId() == earlier.getDeviceId()) {
                    groups[i] = groups[j];
                    found = true;
                    break;
                }
            }
            if (!found) {
                groups[i] = groupCount++;
            }
        }
        return new BatchPlan(groups, groupCount);
    }
}
