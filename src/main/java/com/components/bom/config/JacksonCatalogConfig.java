package com.components.bom.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@Configuration
public class JacksonCatalogConfig {

    /**
     * The application-wide mapper used by MVC, built from Spring Boot's customized builder.
     * Declared explicitly because a second {@link ObjectMapper} bean disables Boot's default one.
     *
     * @param builder Boot's Jackson builder
     * @return the primary ObjectMapper
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(final Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    /**
     * A dedicated {@link ObjectMapper} for raw catalog records.
     * <p>
     * Qualified as <b>catalogObjectMapper</b> so it never replaces the mapper Spring Boot
     * auto-configures for MVC.
     *
     * @return ObjectMapper for catalog records
     */
    @Bean
    @Qualifier("catalogObjectMapper")
    public ObjectMapper catalogObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
