package com.bridgeai.server.ai;

import java.util.Arrays;

/**
 * Group assignment for a set of pending requests. {@code groupIds[i]} is the group
 * of the i-th request; ids are dense and follow first-seen order.
 */
public class BatchPlan {
    private final int[] groupIds;
    private final int groupCount;

    public BatchPlan(int[] groupIds, int groupCount) {
        this.groupIds = groupIds;
        this.groupCount = groupCount;
    }

    public int[] getGroupIds() {
        return Arrays.copyOf(groupIds, groupIds.length);
    }

    public int getGroupId(int requestIndex) {
        return groupIds[requestIndex];
    }

    public int getGroupCount() {
        return groupCount;
    }
}
