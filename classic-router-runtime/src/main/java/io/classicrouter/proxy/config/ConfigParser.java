/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Reads {@link RouteConfig} from YAML.
 *
 * <pre>
 * connectionSharing: true
 * connectRetryTimeout: PT7S
 * waitForMyWritesTimeout: PT2S
 * </pre>
 */
public class ConfigParser {

    private static final ObjectMapper MAPPER = createObjectMapper();

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public RouteConfig parseConfiguration(String configuration) {
        if (configuration.isBlank()) {
            return RouteConfig.defaults();
        }
        try {
            return MAPPER.readValue(configuration, RouteConfig.class);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Couldn't parse configuration", e);
        }
    }

    public RouteConfig parseConfiguration(InputStream configuration) {
        try {
            return MAPPER.readValue(configuration, RouteConfig.class);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse configuration", e);
        }
    }
}
