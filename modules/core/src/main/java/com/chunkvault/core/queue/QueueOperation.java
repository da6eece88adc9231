package com.chunkvault.core.queue;

public enum QueueOperation {
    PUT,
    DELETE
}
