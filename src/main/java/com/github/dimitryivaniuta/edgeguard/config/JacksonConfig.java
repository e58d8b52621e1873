package com.github.dimitryivaniuta.edgeguard.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Central Jackson configuration for:
 * - request bodies read as trees (sync documents are stored verbatim)
 * - compact error envelopes
 */
@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper mapper = builder.createXmlMapper(false).build();

        // Web API safety: do not break on unknown fields (forward compatibility)
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // "{...} garbage" is not a JSON object
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

        // Envelope "details" is optional
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Sync timestamps are compared exactly, never through double
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

        return mapper;
    }
}
