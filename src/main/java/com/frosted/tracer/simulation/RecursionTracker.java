package com.frosted.tracer.simulation;

import java.util.HashMap;
import java.util.Map;

/**
 * Counts active calls per function and in total, and enforces the frame limit.
 */
final class RecursionTracker {
    private final Map<String, Integer> currentCalls = new HashMap<>();
    private final int maxFrames;
    private int activeFrames;

    RecursionTracker(int maxFrames) {
        this.maxFrames = maxFrames;
    }

    boolean canCall() {
        return activeFrames < maxFrames;
    }

    /** Registers a call and returns how many calls of the same function were already active. */
    int startCall(String function) {
        int level = currentCalls.getOrDefault(function, 0);
        currentCalls.put(function, level + 1);
        activeFrames++;
        return level;
    }

    void endCall(String function) {
        Integer level = currentCalls.get(function);
        if (level != null && level > 0) {
            currentCalls.put(function, level - 1);
            activeFrames--;
        }
    }

    int getActiveFrames() {
        return activeFrames;
    }
}
