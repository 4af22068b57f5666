package com.ssau.aips.pipeline.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.ssau.aips.pipeline.config.PipelineConfig;

class ConfigLoaderTest {

    @Test
    void testLoadsFromClasspath() throws IOException {
        PipelineConfig config = ConfigLoader.load("proctor-test.properties");

        assertEquals(5, config.getWindowSize());
        assertEquals(4.5, config.getMotionThreshold());
        assertEquals(300, config.getTimeoutMs());
        assertTrue(config.isEnableRoi());
        assertEquals("phone", config.getForbiddenClasses().get("cell phone"));
        assertEquals("tablet", config.getForbiddenClasses().get("tablet"));
        assertFalse(config.getForbiddenClasses().containsKey("book"));
        assertEquals(25, config.getScoring().getForbiddenItemWeight());
        assertEquals(120, config.getScoring().getScoreCap());
    }

    @Test
    void testReadsRawProperties() throws IOException {
        Properties props = ConfigLoader.readProperties("proctor-test.properties");

        assertEquals("5", props.getProperty("pipeline.window.size"));
    }

    @Test
    void testDefaultFileMatchesBuiltInDefaults() throws IOException {
        assertEquals(PipelineConfig.defaults(), ConfigLoader.loadDefault());
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> ConfigLoader.load("does-not-exist.properties"));
    }
}
