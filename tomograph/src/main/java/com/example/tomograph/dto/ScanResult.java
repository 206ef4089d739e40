package com.example.tomograph.dto;

import java.time.LocalDateTime;

public record ScanResult(
        byte[] pngData,
        String operation,
        String size,
        int detectorCount,
        int scanCount,
        double timeSeconds,
        double cpuPercent,
        double memPercent,
        LocalDateTime startTime,
        LocalDateTime endTime
) {}
