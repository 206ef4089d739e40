package com.example.tomograph.config;

import com.example.tomograph.algorithm.Tomograph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TomographProperties.class)
public class TomographConfig {

    private static final Logger logger = LoggerFactory.getLogger(TomographConfig.class);

    @Bean
    public Tomograph tomograph(TomographProperties properties) {
        logger.info("Scanner engine ready (parallel={}, defaults: {} detectors, {} scans, span {})",
                properties.parallel(), properties.detectorCount(), properties.scanCount(), properties.spanDegrees());
        return new Tomograph(properties.parallel());
    }
}
