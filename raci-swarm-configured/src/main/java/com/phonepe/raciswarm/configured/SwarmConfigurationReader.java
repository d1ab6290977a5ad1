/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.raciswarm.configured;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads swarm configuration from YAML
 */
@Slf4j
@UtilityClass
public class SwarmConfigurationReader {
    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static SwarmConfiguration fromYAML(Path path) {
        log.info("Reading swarm configuration from {}", path);
        try {
            return fromYAMLContent(Files.readAllBytes(path));
        }
        catch (IOException e) {
            throw new SwarmConfigurationException(List.of("Could not read " + path + ": " + e.getMessage()));
        }
    }

    public static SwarmConfiguration fromYAMLContent(byte[] content) {
        try {
            final var configuration = MAPPER.readValue(content, SwarmConfiguration.class);
            if (null == configuration) {
                throw new SwarmConfigurationException(List.of("Configuration is empty"));
            }
            return configuration;
        }
        catch (IOException e) {
            throw new SwarmConfigurationException(List.of("Could not parse configuration: "
                                                                  + e.getMessage()));
        }
    }
}
