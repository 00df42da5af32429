/*
 * Copyright (c) 2025 CGE Kernel
 * Licensed under the Apache License, Version 2.0
 */
package com.cgekernel.runtime.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON persistence of {@link DualSignalsDataset}s.
 */
public class DatasetWriter {

    private final ObjectMapper objectMapper;

    public DatasetWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public DatasetWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(DualSignalsDataset dataset) throws JsonProcessingException {
        return objectMapper.writeValueAsString(dataset);
    }

    public void write(DualSignalsDataset dataset, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), dataset);
    }

    public DualSignalsDataset read(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), DualSignalsDataset.class);
    }
}
