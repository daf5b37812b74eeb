package com.quire.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkingDirectoryTest {

    @TempDir
    Path tempDir;

    @Test
    void enter_setsAndRestoresUserDir() {
        String before = System.getProperty("user.dir");

        try (WorkingDirectory scope = WorkingDirectory.enter(tempDir)) {
            assertEquals(tempDir.toAbsolutePath().normalize().toString(), System.getProperty("user.dir"));
            assertEquals(tempDir.toAbsolutePath().normalize(), scope.getDirectory());
        }

        assertEquals(before, System.getProperty("user.dir"));
    }

    @Test
    void enter_restoresOnException() {
        String before = System.getProperty("user.dir");

        assertThrows(IllegalStateException.class, () -> {
            try (WorkingDirectory ignored = WorkingDirectory.enter(tempDir.toString())) {
                throw new IllegalStateException("boom");
            }
        });

        assertEquals(before, System.getProperty("user.dir"));
    }

    @Test
    void enter_rejectsMissingDirectory() {
        String before = System.getProperty("user.dir");

        assertThrows(IllegalArgumentException.class, () -> WorkingDirectory.enter(tempDir.resolve("missing")));
        assertEquals(before, System.getProperty("user.dir"));
    }

    @Test
    void close_twiceIsHarmless() {
        String before = System.getProperty("user.dir");
        WorkingDirectory scope = WorkingDirectory.enter(tempDir);

        scope.close();
        scope.close();

        assertEquals(before, System.getProperty("user.dir"));
    }

    @Test
    void enter_blocksOtherThreadsUntilScopeCloses() throws Exception {
        String before = System.getProperty("user.dir");
        Path first = Files.createDirectory(tempDir.resolve("first"));
        Path second = Files.createDirectory(tempDir.resolve("second"));
        CountDownLatch entered = new CountDownLatch(1);
        AtomicReference<String> seenBySecond = new AtomicReference<>();

        Thread other = new Thread(() -> {
            try (WorkingDirectory ignored = WorkingDirectory.enter(second)) {
                seenBySecond.set(System.getProperty("user.dir"));
                entered.countDown();
            }
        }, "second-scope");

        try (WorkingDirectory ignored = WorkingDirectory.enter(first)) {
            other.start();

            assertFalse(entered.await(200, TimeUnit.MILLISECONDS));
            assertEquals(first.toAbsolutePath().normalize().toString(), System.getProperty("user.dir"));
        }

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        other.join(5_000);
        assertEquals(second.toAbsolutePath().normalize().toString(), seenBySecond.get());
        assertEquals(before, System.getProperty("user.dir"));
    }
}
