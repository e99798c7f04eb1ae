package com.sketchmath.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sketchmath.server.pipeline.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class PipelineConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String CONFIG_PROPERTY = "sketchmath.config";
    public static final String CLASSPATH_CONFIG = "/pipeline_config.json";

    public static PipelineConfig load() {
        ObjectMapper mapper = new ObjectMapper();

        // 1. Check System Property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            File file = new File(sysProp);
            try {
                logger.info("Loading pipeline config from {}", file.getAbsolutePath());
                return sanitize(mapper.readValue(file, PipelineConfig.class));
            } catch (IOException e) {
                logger.warn("Failed to read pipeline config from {}, falling back to classpath: {}", sysProp,
                        e.getMessage());
            }
        }

        // 2. Check Config File
        try (InputStream is = PipelineConfigLoader.class.getResourceAsStream(CLASSPATH_CONFIG)) {
            if (is != null) {
                return sanitize(mapper.readValue(is, PipelineConfig.class));
            }
        } catch (IOException e) {
            logger.warn("Failed to read {} from classpath: {}", CLASSPATH_CONFIG, e.getMessage());
        }

        // 3. Default
        logger.info("No pipeline config found, using defaults");
        return PipelineConfig.defaults();
    }

    static PipelineConfig sanitize(PipelineConfig loaded) {
        PipelineConfig defaults = PipelineConfig.defaults();
        PipelineConfig config = loaded.copy();
        if (config.angleUnit == null
                || !(PipelineConfig.DEGREES.equalsIgnoreCase(config.angleUnit)
                        || PipelineConfig.RADIANS.equalsIgnoreCase(config.angleUnit))) {
            logger.warn("Unknown angleUnit '{}', defaulting to '{}'", config.angleUnit, defaults.angleUnit);
            config.angleUnit = defaults.angleUnit;
        }
        if (config.significantDigits < 1 || config.significantDigits > 17) {
            logger.warn("significantDigits {} out of range, defaulting to {}", config.significantDigits,
                    defaults.significantDigits);
            config.significantDigits = defaults.significantDigits;
        }
        if (config.maxRootIterations <= 0) {
            logger.warn("maxRootIterations {} must be positive, defaulting to {}", config.maxRootIterations,
                    defaults.maxRootIterations);
            config.maxRootIterations = defaults.maxRootIterations;
        }
        if (!(config.rootTolerance > 0)) {
            logger.warn("rootTolerance {} must be positive, defaulting to {}", config.rootTolerance,
                    defaults.rootTolerance);
            config.rootTolerance = defaults.rootTolerance;
        }
        return config;
    }
}
