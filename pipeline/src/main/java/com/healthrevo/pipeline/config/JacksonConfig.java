package com.healthrevo.pipeline.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * One mapper for the HTTP codecs and for the JSON columns (alert metadata, risk drivers and
 * recommendations, prescription medications and flags).
 *
 * <p>Map entries are written in key order so a recomputed risk result produces the same column
 * text as the stored one. Vital measurements are whole numbers: {@code "systolic": 120.5} is
 * rejected instead of being truncated. Request bodies may carry a base64 prescription scan, so
 * the decoder buffer is sized by {@code cds.http.max-document-bytes}.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(JacksonConfig.class);

    private final int maxDocumentBytes;

    public JacksonConfig(@Value("${cds.http.max-document-bytes:10485760}") int maxDocumentBytes) {
        this.maxDocumentBytes = maxDocumentBytes;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .build();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = objectMapper();
        Jackson2JsonDecoder decoder = new Jackson2JsonDecoder(mapper);
        decoder.setMaxInMemorySize(maxDocumentBytes);
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(decoder);
        configurer.defaultCodecs().maxInMemorySize(maxDocumentBytes);
        logger.debug("JSON request bodies limited to {} bytes", maxDocumentBytes);
    }
}
