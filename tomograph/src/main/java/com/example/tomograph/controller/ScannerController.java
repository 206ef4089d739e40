package com.example.tomograph.controller;

import com.example.tomograph.dto.ExperimentResponse;
import com.example.tomograph.dto.RmseResponse;
import com.example.tomograph.dto.ScanResult;
import com.example.tomograph.dto.SweepParameter;
import com.example.tomograph.service.ExperimentService;
import com.example.tomograph.service.ScanService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

@RestController
public class ScannerController {

    private final ScanService scanService;
    private final ExperimentService experimentService;
    private final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public ScannerController(ScanService scanService, ExperimentService experimentService) {
        this.scanService = scanService;
        this.experimentService = experimentService;
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("OK");
    }

    @PostMapping(
            value = "/scanner/sinogram",
            consumes = {MediaType.IMAGE_PNG_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE}
    )
    public ResponseEntity<byte[]> sinogram(
            @RequestBody byte[] image,
            @RequestHeader(value = "X-Detectors", required = false) Integer detectors,
            @RequestHeader(value = "X-Scans", required = false) Integer scans,
            @RequestHeader(value = "X-Angle-Step", required = false) Double angleStep,
            @RequestHeader(value = "X-Span", required = false) Double span
    ) {
        return png(scanService.sinogram(image, detectors, scans, angleStep, span));
    }

    @PostMapping(
            value = "/scanner/reconstruct",
            consumes = {MediaType.IMAGE_PNG_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE}
    )
    public ResponseEntity<byte[]> reconstruct(
            @RequestBody byte[] sinogram,
            @RequestHeader("X-Height") int height,
            @RequestHeader("X-Width") int width,
            @RequestHeader(value = "X-Span", required = false) Double span,
            @RequestHeader(value = "X-Filter", defaultValue = "false") boolean useFilter,
            @RequestHeader(value = "X-Detectors", required = false) Integer detectors,
            @RequestHeader(value = "X-Scan-Limit", required = false) Integer scanLimit
    ) {
        return png(scanService.reconstruct(sinogram, height, width, span, useFilter, detectors, scanLimit));
    }

    @PostMapping(value = "/scanner/rmse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public RmseResponse rmse(
            @RequestPart("original") MultipartFile original,
            @RequestPart("reconstructed") MultipartFile reconstructed
    ) throws IOException {
        return new RmseResponse(scanService.rmse(original.getBytes(), reconstructed.getBytes()));
    }

    @GetMapping(value = "/scanner/phantoms/{id}", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> phantom(@PathVariable("id") String phantomId) {
        return ResponseEntity.ok(scanService.phantomPng(phantomId));
    }

    @PostMapping("/scanner/experiment")
    public ExperimentResponse experiment(
            @RequestBody(required = false) byte[] image,
            @RequestHeader(value = "X-Phantom", required = false) String phantomId,
            @RequestHeader("X-Parameter") String parameter,
            @RequestHeader(value = "X-Values", required = false) String values,
            @RequestHeader(value = "X-Filter", defaultValue = "false") boolean useFilter
    ) {
        SweepParameter sweepParameter = SweepParameter.fromKey(parameter);
        List<Integer> sweepValues = parseValues(values);
        if (phantomId != null) {
            return experimentService.runOnPhantom(phantomId, sweepParameter, sweepValues, useFilter);
        }
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Send an image body or an X-Phantom header.");
        }
        return experimentService.runOnImage(image, sweepParameter, sweepValues, useFilter);
    }

    private static List<Integer> parseValues(String values) {
        if (values == null || values.isBlank()) {
            return List.of();
        }
        try {
            return Arrays.stream(values.split(",")).map(String::trim).map(Integer::valueOf).toList();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("X-Values must be a comma separated list of integers: " + values, e);
        }
    }

    private ResponseEntity<byte[]> png(ScanResult result) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.IMAGE_PNG);
        headers.add("X-Operation", result.operation());
        headers.add("X-Start", result.startTime().format(formatter));
        headers.add("X-End", result.endTime().format(formatter));
        headers.add("X-Size", result.size());
        headers.add("X-Detectors", String.valueOf(result.detectorCount()));
        headers.add("X-Scans", String.valueOf(result.scanCount()));
        headers.add("X-Time", String.valueOf(result.timeSeconds()));
        headers.add("X-Cpu", String.format("%.1f", result.cpuPercent()));
        headers.add("X-Mem", String.format("%.1f", result.memPercent()));

        return ResponseEntity.ok()
                .headers(headers)
                .body(result.pngData());
    }
}
