package com.sketchmath.server.util;

import com.sketchmath.server.pipeline.PipelineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    public void clearProperty() {
        System.clearProperty(PipelineConfigLoader.CONFIG_PROPERTY);
    }

    @Test
    public void testLoadConfigFromClasspath() {
        PipelineConfig config = PipelineConfigLoader.load();
        assertNotNull(config);
        // pipeline_config.json ships with degrees and 12 significant digits
        assertEquals(PipelineConfig.DEGREES, config.angleUnit);
        assertTrue(config.anglesInDegrees());
        assertEquals(12, config.significantDigits);
        assertEquals(500, config.maxRootIterations);
        assertEquals(1e-12, config.rootTolerance, 1e-20);
    }

    @Test
    public void testSystemPropertyOverridesClasspath() throws IOException {
        Path file = tempDir.resolve("pipeline.json");
        Files.writeString(file, "{\"angleUnit\": \"radians\", \"significantDigits\": 6, \"comment\": \"ignored\"}");
        System.setProperty(PipelineConfigLoader.CONFIG_PROPERTY, file.toString());

        PipelineConfig config = PipelineConfigLoader.load();
        assertEquals(PipelineConfig.RADIANS, config.angleUnit);
        assertFalse(config.anglesInDegrees());
        assertEquals(6, config.significantDigits);
        // Fields missing from the file keep their defaults
        assertEquals(500, config.maxRootIterations);
    }

    @Test
    public void testUnreadableOverrideFallsBackToClasspath() {
        System.setProperty(PipelineConfigLoader.CONFIG_PROPERTY, tempDir.resolve("missing.json").toString());
        PipelineConfig config = PipelineConfigLoader.load();
        assertEquals(PipelineConfig.DEGREES, config.angleUnit);
    }

    @Test
    public void testInvalidValuesAreReplacedByDefaults() {
        PipelineConfig loaded = new PipelineConfig("gradians", 0, -1, 0.0);
        PipelineConfig config = PipelineConfigLoader.sanitize(loaded);
        assertEquals(PipelineConfig.DEGREES, config.angleUnit);
        assertEquals(12, config.significantDigits);
        assertEquals(500, config.maxRootIterations);
        assertEquals(1e-12, config.rootTolerance, 1e-20);
        // The loaded instance is not modified
        assertEquals("gradians", loaded.angleUnit);
    }
}
