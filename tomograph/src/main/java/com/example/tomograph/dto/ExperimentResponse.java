package com.example.tomograph.dto;

import java.time.ZonedDateTime;
import java.util.List;

public record ExperimentResponse(String parameter,
    boolean filtered,
    ZonedDateTime startTime,
    ZonedDateTime endTime,
    long durationMs,
    String imageSize,
    List<ExperimentPoint> points) {
}
