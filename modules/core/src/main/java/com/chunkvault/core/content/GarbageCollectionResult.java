package com.chunkvault.core.content;

import java.util.List;

/**
 * Outcome of one garbage collection pass. {@code errors} holds one message per blob
 * that could not be collected; the pass itself never aborts.
 */
public record GarbageCollectionResult(int deleted, long freedBytes, List<String> errors, long durationMs) {

    public GarbageCollectionResult {
        errors = List.copyOf(errors);
    }
}
