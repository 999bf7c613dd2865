package com.example.grouping.json;

import com.example.grouping.pivot.PivotConfig;
import com.example.grouping.resolver.GroupingConfig;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads grouping and pivot configurations from JSON.
 *
 * <p>Only the shape of the document is checked here; semantic validation
 * (conflicting functions, unknown ids, malformed conditions) happens when
 * the configuration is handed to the engine.
 */
public class GroupingConfigReader {

    private final ObjectMapper objectMapper;

    public GroupingConfigReader() {
        this(JsonSupport.objectMapper());
    }

    public GroupingConfigReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GroupingConfig readGroupingConfig(InputStream inputStream) throws IOException {
        return objectMapper.readValue(inputStream, GroupingConfig.class);
    }

    public GroupingConfig readGroupingConfig(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return readGroupingConfig(in);
        }
    }

    public PivotConfig readPivotConfig(InputStream inputStream) throws IOException {
        return objectMapper.readValue(inputStream, PivotConfig.class);
    }

    public PivotConfig readPivotConfig(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return readPivotConfig(in);
        }
    }
}
