package com.cohortengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cohort engine configuration.
 * Feature toggles and sizing are read from application properties and exposed
 * as immutable settings records, so no component reads global state directly.
 */
@Configuration
public class CohortConfig {

    @Value("${cohort.precalculation.enabled:true}")
    private boolean precalculationEnabled;

    // Membership rows started being written at this point; older calculations predate the table
    @Value("${cohort.precalculation.cutover:2021-06-07T15:00:00Z}")
    private String precalculationCutover;

    @Value("${cohort.materialization.batch-size:10000}")
    private int batchSize;

    @Value("${cohort.static.insert-chunk-size:10000}")
    private int staticInsertChunkSize;

    @Value("${cohort.query.max-attempts:3}")
    private int queryMaxAttempts;

    @Value("${cohort.query.initial-backoff-ms:100}")
    private long queryInitialBackoffMs;

    @Value("${cohort.query.max-backoff-ms:2000}")
    private long queryMaxBackoffMs;

    @Bean
    public PrecalculationSettings precalculationSettings() {
        return new PrecalculationSettings(precalculationEnabled, Instant.parse(precalculationCutover));
    }

    @Bean
    public MaterializationSettings materializationSettings() {
        return new MaterializationSettings(batchSize, staticInsertChunkSize);
    }

    @Bean
    public QueryRetrySettings queryRetrySettings() {
        return new QueryRetrySettings(
            queryMaxAttempts,
            Duration.ofMillis(queryInitialBackoffMs),
            Duration.ofMillis(queryMaxBackoffMs)
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
