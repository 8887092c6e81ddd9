package com.cohortengine.service;

import com.cohortengine.config.QueryRetrySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs generated SQL against the event/person store.
 *
 * Transient failures (timeouts, lock contention, lost connections) of reads are
 * retried with exponential backoff up to the configured number of attempts; any
 * other failure, or the last transient one, propagates. Writes run once: a write
 * that fails inside a transaction is retried by rerunning the whole transaction
 * through {@link #retrying}.
 */
@Component
@Slf4j
public class EventStoreQueryExecutor {

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final QueryRetrySettings retrySettings;
    private final Sleeper sleeper;

    @Autowired
    public EventStoreQueryExecutor(NamedParameterJdbcTemplate jdbcTemplate, QueryRetrySettings retrySettings) {
        this(jdbcTemplate, retrySettings, duration -> Thread.sleep(duration.toMillis()));
    }

    EventStoreQueryExecutor(NamedParameterJdbcTemplate jdbcTemplate, QueryRetrySettings retrySettings, Sleeper sleeper) {
        this.jdbcTemplate = jdbcTemplate;
        this.retrySettings = retrySettings;
        this.sleeper = sleeper;
    }

    public <T> List<T> queryForList(String sql, SqlParameterSource parameters, Class<T> elementType) {
        return retrying("queryForList", () -> jdbcTemplate.queryForList(sql, parameters, elementType));
    }

    public <T> List<T> query(String sql, SqlParameterSource parameters, RowMapper<T> rowMapper) {
        return retrying("query", () -> jdbcTemplate.query(sql, parameters, rowMapper));
    }

    public <T> T queryForObject(String sql, SqlParameterSource parameters, Class<T> requiredType) {
        return retrying("queryForObject", () -> jdbcTemplate.queryForObject(sql, parameters, requiredType));
    }

    /**
     * Single attempt. Part of a failed batch may already be applied, so the
     * caller retries the enclosing transaction, never the batch alone.
     */
    public int[] batchUpdate(String sql, SqlParameterSource[] batch) {
        return jdbcTemplate.batchUpdate(sql, batch);
    }

    /**
     * Run {@code attempt} until it succeeds, retrying transient failures with backoff.
     * Each attempt must start its own transaction.
     */
    public <T> T retrying(String operation, Supplier<T> attempt) {
        int attemptNumber = 1;
        while (true) {
            try {
                return attempt.get();
            } catch (TransientDataAccessException e) {
                if (attemptNumber >= retrySettings.maxAttempts()) {
                    log.error("Event store {} failed after {} attempts", operation, attemptNumber, e);
                    throw e;
                }
                Duration delay = retrySettings.backoffFor(attemptNumber);
                log.warn("Event store {} attempt {} failed transiently, retrying in {} ms: {}",
                    operation, attemptNumber, delay.toMillis(), e.getMessage());
                sleep(delay, e);
                attemptNumber++;
            }
        }
    }

    private void sleep(Duration delay, TransientDataAccessException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(interrupted);
            throw cause;
        }
    }
}
