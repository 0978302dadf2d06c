package com.williamcallahan.actdb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers the JSON mapper used for stored acts, state files and fixups, and the clock that
 * defines "today" for the command line.
 */
@Configuration
public class PersistenceConfig {

    /**
     * Creates the shared object mapper with ISO date handling.
     *
     * @return configured object mapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    /**
     * Creates the system clock in the default time zone.
     *
     * @return clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Builds an object mapper configured like the application bean, for use outside the context.
     *
     * @return configured object mapper
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
