package com.example.tomograph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Settings under the {@code tomograph} prefix.
 *
 * @param parallel      run per-angle work on a parallel stream
 * @param detectorCount default detectors per scan
 * @param scanCount     default scans over the 180 degree sweep
 * @param spanDegrees   default angular width of the detector array
 * @param phantoms      phantom id to classpath csv
 */
@ConfigurationProperties(prefix = "tomograph")
public record TomographProperties(
        @DefaultValue("false") boolean parallel,
        @DefaultValue("180") int detectorCount,
        @DefaultValue("180") int scanCount,
        @DefaultValue("180") double spanDegrees,
        Map<String, String> phantoms,
        Experiment experiment) {

    public TomographProperties {
        phantoms = phantoms == null ? Map.of() : Map.copyOf(phantoms);
        experiment = experiment == null ? new Experiment(false, "results") : experiment;
    }

    public record Experiment(
            @DefaultValue("false") boolean persist,
            @DefaultValue("results") String outputDir) {
    }
}
