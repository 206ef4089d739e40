package com.example.tomograph.service;

import com.example.tomograph.algorithm.Tomograph;
import com.example.tomograph.config.TomographProperties;
import com.example.tomograph.dto.ExperimentPoint;
import com.example.tomograph.dto.ExperimentResponse;
import com.example.tomograph.dto.SweepParameter;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sweeps one scan parameter and measures reconstruction error for each value,
 * holding the others at their configured defaults.
 */
@Service
public class ExperimentService {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentService.class);

    private final Tomograph tomograph;
    private final ImageCodec imageCodec;
    private final PhantomCacheService phantomCacheService;
    private final TomographProperties properties;

    public ExperimentService(Tomograph tomograph, ImageCodec imageCodec,
                             PhantomCacheService phantomCacheService, TomographProperties properties) {
        this.tomograph = tomograph;
        this.imageCodec = imageCodec;
        this.phantomCacheService = phantomCacheService;
        this.properties = properties;
    }

    public ExperimentResponse runOnPhantom(String phantomId, SweepParameter parameter,
                                           List<Integer> values, boolean useFilter) {
        return run(phantomCacheService.getPhantom(phantomId), parameter, values, useFilter);
    }

    public ExperimentResponse runOnImage(byte[] imageData, SweepParameter parameter,
                                         List<Integer> values, boolean useFilter) {
        return run(imageCodec.decode(imageData), parameter, values, useFilter);
    }

    /**
     * @param values parameter values to try; the parameter's default range when empty
     */
    public ExperimentResponse run(INDArray image, SweepParameter parameter, List<Integer> values, boolean useFilter) {
        List<Integer> sweep = values == null || values.isEmpty() ? parameter.defaultValues() : values;
        String tag = parameter.key() + "_" + (useFilter ? "filter" : "nofilter");
        int height = (int) image.rows();
        int width = (int) image.columns();
        logger.info("=== Sweep {} over {} on a {}x{} image ===", tag, sweep, height, width);
        ZonedDateTime startTime = ZonedDateTime.now();
        long startNanos = System.nanoTime();

        List<ExperimentPoint> points = new ArrayList<>(sweep.size());
        for (int value : sweep) {
            int detectors = parameter == SweepParameter.DETECTOR_COUNT ? value : properties.detectorCount();
            int scans = parameter == SweepParameter.SCAN_COUNT ? value : properties.scanCount();
            double span = parameter == SweepParameter.SPAN ? value : properties.spanDegrees();

            INDArray sinogram = tomograph.buildSinogram(image, scans, detectors, span);
            INDArray reconstructed = tomograph.reconstruct(height, width, sinogram, span, useFilter);
            double rmse = tomograph.rmse(image, reconstructed);
            points.add(new ExperimentPoint(value, rmse));
            logger.info(" - [SWEEP] {}={} -> RMSE {}", parameter.key(), value, String.format("%.4f", rmse));

            if (properties.experiment().persist()) {
                writePng(tag, parameter.key() + "_" + value + ".png", reconstructed);
            }
        }
        if (properties.experiment().persist()) {
            writeCurve(tag, points);
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        return new ExperimentResponse(parameter.key(), useFilter, startTime, ZonedDateTime.now(),
                durationMs, height + "x" + width, List.copyOf(points));
    }

    private void writePng(String tag, String filename, INDArray image) {
        Path dir = Path.of(properties.experiment().outputDir(), tag);
        try {
            Files.createDirectories(dir);
            Files.write(dir.resolve(filename), imageCodec.encode(image));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + dir.resolve(filename), e);
        }
    }

    private void writeCurve(String tag, List<ExperimentPoint> points) {
        Path file = Path.of(properties.experiment().outputDir(), "rmse_" + tag + ".csv");
        List<String> lines = new ArrayList<>(points.size() + 1);
        lines.add("value,rmse");
        for (ExperimentPoint point : points) {
            lines.add(point.value() + "," + String.format(Locale.ROOT, "%.6f", point.rmse()));
        }
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, lines);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
        logger.info("RMSE curve written to {}", file);
    }
}
