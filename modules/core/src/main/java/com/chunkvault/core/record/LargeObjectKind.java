package com.chunkvault.core.record;

import com.chunkvault.core.queue.QueuePriority;

/**
 * Large derived artifacts stored beside a record's metadata, one value each.
 */
public enum LargeObjectKind {
    SUMMARY("summary", QueuePriority.NORMAL),
    AUDIO_INSIGHTS("audio-insights", QueuePriority.NORMAL),
    CANVAS_SPEC("canvas-spec", QueuePriority.CRITICAL),
    TRANSCRIPTION("transcription", QueuePriority.NORMAL),
    CONTEXT_ITEMS("context-items", QueuePriority.NORMAL);

    private final String path;
    private final QueuePriority priority;

    LargeObjectKind(String path, QueuePriority priority) {
        this.path = path;
        this.priority = priority;
    }

    public String path() {
        return path;
    }

    /** Priority its writes are queued at. */
    public QueuePriority priority() {
        return priority;
    }
}
