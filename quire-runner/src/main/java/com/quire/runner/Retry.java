package com.quire.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded retry of I/O actions that fail with {@link UncheckedIOException}. Malformed or unmappable JSON
 * ({@link JsonProcessingException} cause) fails on the first attempt.
 */
public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private Retry() {
    }

    /**
     * Runs {@code action} up to {@code attempts} times (at least once). Other exceptions are not retried.
     *
     * @return the first successful result
     * @throws UncheckedIOException the last failure when every attempt failed
     */
    public static <T> T call(int attempts, Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        int max = Math.max(1, attempts);
        UncheckedIOException last = null;
        for (int attempt = 1; attempt <= max; attempt++) {
            try {
                return action.get();
            } catch (UncheckedIOException e) {
                if (e.getCause() instanceof JsonProcessingException) {
                    throw e;
                }
                last = e;
                if (attempt < max) {
                    log.warn("I/O attempt {}/{} failed: {}; retrying", attempt, max, e.getMessage());
                }
            }
        }
        throw last;
    }
}
