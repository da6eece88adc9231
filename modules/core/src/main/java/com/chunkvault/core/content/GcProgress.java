package com.chunkvault.core.content;

public record GcProgress(int current, int total, String status, double percentage) {

    static GcProgress of(int current, int total, String status) {
        double percentage = total == 0 ? 100.0 : (current * 100.0) / total;
        return new GcProgress(current, total, status, percentage);
    }
}
