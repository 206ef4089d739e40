package com.example.tomograph.service;

import com.example.tomograph.config.TomographProperties;
import jakarta.annotation.PostConstruct;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test images kept in memory so sweeps and demos need no upload.
 */
@Service
public class PhantomCacheService {

    private static final Logger logger = LoggerFactory.getLogger(PhantomCacheService.class);

    private final Map<String, INDArray> phantomCache = new ConcurrentHashMap<>();
    private final TomographProperties properties;
    private final ResourceLoader resourceLoader;

    public PhantomCacheService(TomographProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void loadPhantoms() {
        logger.info("=== Preloading {} phantom(s) ===", properties.phantoms().size());
        properties.phantoms().forEach(this::loadPhantom);
        logger.info("=== Phantoms ready: {} ===", phantomCache.keySet());
    }

    private void loadPhantom(String phantomId, String filename) {
        logger.info(" - [PHANTOM] Loading '{}' from '{}'...", phantomId, filename);
        // streamed, so entries packed inside the jar load too
        try (InputStream in = resourceLoader.getResource("classpath:" + filename).getInputStream()) {
            INDArray phantom = Nd4j.readNumpy(in, ",").castTo(DataType.DOUBLE);
            phantomCache.put(phantomId, phantom);
            logger.info(" - [PHANTOM] '{}' loaded. Dimensions: {}x{}, max={}",
                    phantomId, phantom.rows(), phantom.columns(), phantom.maxNumber());
        } catch (IOException e) {
            logger.error("Failed to load phantom {} from {}", phantomId, filename, e);
        }
    }

    public INDArray getPhantom(String phantomId) {
        INDArray phantom = phantomCache.get(phantomId);
        if (phantom == null) {
            throw new IllegalArgumentException("Phantom '" + phantomId + "' is not in the cache.");
        }
        return phantom;
    }

    public Set<String> phantomIds() {
        return Set.copyOf(phantomCache.keySet());
    }
}
