package com.example.tomograph.dto;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Scan parameter varied by a sweep, with its default range.
 */
public enum SweepParameter {
    DETECTOR_COUNT("detector_count", 90, 720, 90),
    SCAN_COUNT("scan_count", 90, 720, 90),
    SPAN("span", 45, 270, 45);

    private final String key;
    private final int from;
    private final int to;
    private final int step;

    SweepParameter(String key, int from, int to, int step) {
        this.key = key;
        this.from = from;
        this.to = to;
        this.step = step;
    }

    public String key() {
        return key;
    }

    public List<Integer> defaultValues() {
        return IntStream.iterate(from, v -> v <= to, v -> v + step).boxed().toList();
    }

    public static SweepParameter fromKey(String key) {
        String normalized = key.trim().toLowerCase();
        for (SweepParameter parameter : values()) {
            if (parameter.key.equals(normalized)) {
                return parameter;
            }
        }
        throw new IllegalArgumentException("Unknown sweep parameter: " + key);
    }
}
