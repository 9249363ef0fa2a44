package com.tracelens.dashboard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tracelens.common.engine.TraceInsightsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class DashboardConfig {

    private static final Logger log = LoggerFactory.getLogger(DashboardConfig.class);

    @Value("${tracelens.dashboard.zone:UTC}")
    private String zone;

    @Bean
    public TraceInsightsEngine traceInsightsEngine() {
        ZoneId bucketZone = ZoneId.of(zone);
        log.info("Trace insights engine configured. zone={}", bucketZone);
        return new TraceInsightsEngine(bucketZone, discrepancy ->
            log.warn("Span duration disagrees with its timestamps. traceId={} spanId={} declaredMs={} measuredMs={}",
                     discrepancy.traceId(), discrepancy.spanId(),
                     discrepancy.declaredDurationMs(), discrepancy.measuredDurationMs()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    /**
     * Mapper shared by the HTTP codecs and the upstream client. Writes ISO instants and
     * ignores extra fields. A null in a numeric field is a read error rather than 0.
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        return mapper;
    }
}
