package com.voicemaster.sync.jetstream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Central Jackson configuration, shared by the HTTP command surface, the platform bridge
 * requests and the member event decoder.
 *
 * <h2>Key settings</h2>
 * <ul>
 *   <li>{@link JavaTimeModule}: {@code Instant} fields ({@code occurredAt}, {@code createdAt}).</li>
 *   <li>{@code WRITE_DATES_AS_TIMESTAMPS = false}: ISO-8601 text instead of numbers.</li>
 *   <li>Unknown properties are ignored so the bridge can add fields without breaking older
 *       coordinators.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return newMapper();
    }

    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
