package com.example.tomograph.service;

import com.example.tomograph.algorithm.ShapeMismatchException;
import com.example.tomograph.algorithm.Tomograph;
import com.example.tomograph.config.TomographProperties;
import com.example.tomograph.dto.ScanResult;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;

import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs scanner operations on uploaded images and reports how long they took
 * and how loaded the host was.
 */
@Service
public class ScanService {

    private static final Logger logger = LoggerFactory.getLogger(ScanService.class);

    private final Tomograph tomograph;
    private final ImageCodec imageCodec;
    private final PhantomCacheService phantomCacheService;
    private final TomographProperties properties;
    private final SystemInfo systemInfo;
    private final CentralProcessor processor;

    private final ReentrantLock cpuLock = new ReentrantLock();
    private long[] prevTicks;

    public ScanService(Tomograph tomograph, ImageCodec imageCodec,
                       PhantomCacheService phantomCacheService, TomographProperties properties) {
        this.tomograph = tomograph;
        this.imageCodec = imageCodec;
        this.phantomCacheService = phantomCacheService;
        this.properties = properties;
        this.systemInfo = new SystemInfo();
        this.processor = systemInfo.getHardware().getProcessor();
        this.prevTicks = processor.getSystemCpuLoadTicks();
    }

    /**
     * Forward-projects an uploaded image. {@code angleStep} is only used when
     * {@code scans} is absent.
     */
    public ScanResult sinogram(byte[] imageData, Integer detectors, Integer scans, Double angleStep, Double span) {
        int detectorCount = detectors != null ? detectors : properties.detectorCount();
        int scanCount = scans != null ? scans
                : angleStep != null ? Tomograph.scanCountForStep(angleStep) : properties.scanCount();
        double spanDegrees = span != null ? span : properties.spanDegrees();
        logger.info("Starting sinogram. Detectors={}, Scans={}, Span={}", detectorCount, scanCount, spanDegrees);
        LocalDateTime startTime = LocalDateTime.now();
        long startNanos = System.nanoTime();

        INDArray image = imageCodec.decode(imageData);
        INDArray sinogram = tomograph.buildSinogram(image, scanCount, detectorCount, spanDegrees);

        return finish("sinogram", sinogram, detectorCount, scanCount, startTime, startNanos);
    }

    /**
     * Reconstructs a {@code height x width} image from an uploaded sinogram.
     *
     * @param expectedDetectors when given, must equal the sinogram's row count
     * @param scanLimit         when given, only the first scans are used
     */
    public ScanResult reconstruct(byte[] sinogramData, int height, int width, Double span, boolean useFilter,
                                  Integer expectedDetectors, Integer scanLimit) {
        double spanDegrees = span != null ? span : properties.spanDegrees();
        logger.info("Starting reconstruction. Shape={}x{}, Span={}, Filter={}, ScanLimit={}",
                height, width, spanDegrees, useFilter, scanLimit);
        LocalDateTime startTime = LocalDateTime.now();
        long startNanos = System.nanoTime();

        INDArray sinogram = imageCodec.decode(sinogramData);
        if (expectedDetectors != null && expectedDetectors != sinogram.rows()) {
            throw new ShapeMismatchException("Sinogram has " + sinogram.rows() + " detector rows, expected "
                    + expectedDetectors);
        }
        if (scanLimit != null) {
            sinogram = Tomograph.leadingScans(sinogram, scanLimit);
        }
        INDArray image = tomograph.reconstruct(height, width, sinogram, spanDegrees, useFilter);

        return finish("reconstruction", image, (int) sinogram.rows(), (int) sinogram.columns(),
                startTime, startNanos);
    }

    public double rmse(byte[] originalData, byte[] reconstructedData) {
        double rmse = tomograph.rmse(imageCodec.decode(originalData), imageCodec.decode(reconstructedData));
        logger.info("[METRIC] RMSE: {}", String.format("%.4f", rmse));
        return rmse;
    }

    public byte[] phantomPng(String phantomId) {
        return imageCodec.encode(phantomCacheService.getPhantom(phantomId));
    }

    private ScanResult finish(String operation, INDArray output, int detectorCount, int scanCount,
                              LocalDateTime startTime, long startNanos) {
        byte[] pngData = imageCodec.encode(output);

        double cpuPercent = getCpuUsage();
        GlobalMemory memory = systemInfo.getHardware().getMemory();
        double memPercent = (memory.getTotal() - memory.getAvailable()) * 100.0 / memory.getTotal();

        LocalDateTime endTime = LocalDateTime.now();
        double durationSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        logger.info("Finished {} ({}x{}) in {} s", operation, output.rows(), output.columns(),
                String.format("%.3f", durationSeconds));

        return new ScanResult(
                pngData,
                operation,
                output.rows() + "x" + output.columns(),
                detectorCount,
                scanCount,
                durationSeconds,
                cpuPercent,
                memPercent,
                startTime,
                endTime
        );
    }

    private double getCpuUsage() {
        cpuLock.lock();
        try {
            double load = processor.getSystemCpuLoadBetweenTicks(this.prevTicks) * 100.0;
            this.prevTicks = processor.getSystemCpuLoadTicks();
            return load;
        } finally {
            cpuLock.unlock();
        }
    }
}
