package com.quire.runner;

import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryTest {

    @Test
    void call_returnsFirstSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = Retry.call(3, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new UncheckedIOException(new IOException("flaky"));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(2, attempts.get());
    }

    @Test
    void call_rethrowsLastFailure() {
        AtomicInteger attempts = new AtomicInteger();
        UncheckedIOException last = new UncheckedIOException(new IOException("last"));

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> Retry.call(2, () -> {
            if (attempts.incrementAndGet() == 2) {
                throw last;
            }
            throw new UncheckedIOException(new IOException("first"));
        }));

        assertSame(last, e);
        assertEquals(2, attempts.get());
    }

    @Test
    void call_doesNotRetryOtherExceptions() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> Retry.call(5, () -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad");
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    void call_doesNotRetryJsonParseFailures() {
        AtomicInteger attempts = new AtomicInteger();
        UncheckedIOException malformed = new UncheckedIOException(new JsonParseException(null, "unexpected end"));

        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> Retry.call(3, () -> {
            attempts.incrementAndGet();
            throw malformed;
        }));

        assertSame(malformed, e);
        assertEquals(1, attempts.get());
    }

    @Test
    void call_runsAtLeastOnce() {
        assertEquals(1, Retry.call(0, () -> 1));
    }
}
