package com.ssau.aips.pipeline.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;

@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_FILE = "proctor.properties";

    private ConfigLoader() {}

    public static PipelineConfig loadDefault() throws IOException {
        return load(DEFAULT_FILE);
    }

    public static PipelineConfig load(String fileName) throws IOException {
        PipelineConfig config = PipelineConfig.fromProperties(readProperties(fileName));
        log.info("Pipeline config from {}: window={}, timeout={}ms, sampling={}..{} fps, roi={}",
            fileName, config.getWindowSize(), config.getTimeoutMs(), config.getMinFps(), config.getMaxFps(),
            config.isEnableRoi());
        return config;
    }

    // working directory, then config/, then the classpath
    static Properties readProperties(String fileName) throws IOException {
        Properties props = new Properties();
        for (Path candidate : List.of(Paths.get(fileName), Paths.get("config", fileName))) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try (Reader reader = Files.newBufferedReader(candidate, StandardCharsets.UTF_8)) {
                props.load(reader);
                log.debug("Read {}", candidate.toAbsolutePath());
                return props;
            } catch (IOException ex) {
                log.warn("Cannot read {}, falling back", candidate, ex);
            }
        }

        InputStream input = ConfigLoader.class.getClassLoader().getResourceAsStream(fileName);
        if (input == null) {
            throw new IOException("No '" + fileName + "' in the working directory, config/ or on the classpath");
        }
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        log.debug("Read {} from the classpath", fileName);
        return props;
    }
}
