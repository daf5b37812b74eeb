package com.quire.runner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scoped change of the process working directory ({@code user.dir}). The directory is process-wide
 * state, so scopes are serialized by one global lock held until {@link #close()}.
 * <pre>
 * try (WorkingDirectory ignored = WorkingDirectory.enter(dir)) {
 *     ...
 * }
 * </pre>
 */
public final class WorkingDirectory implements AutoCloseable {

    static final String USER_DIR = "user.dir";

    private static final ReentrantLock LOCK = new ReentrantLock();

    private final Path directory;
    private final String previous;
    private boolean closed;

    private WorkingDirectory(Path directory, String previous) {
        this.directory = directory;
        this.previous = previous;
    }

    public static WorkingDirectory enter(String directory) {
        Objects.requireNonNull(directory, "directory");
        return enter(Path.of(directory));
    }

    /**
     * @throws IllegalArgumentException if {@code directory} is not an existing directory (checked before locking)
     */
    public static WorkingDirectory enter(Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Working directory does not exist: " + directory);
        }
        Path absolute = directory.toAbsolutePath().normalize();
        LOCK.lock();
        try {
            String previous = System.getProperty(USER_DIR);
            System.setProperty(USER_DIR, absolute.toString());
            return new WorkingDirectory(absolute, previous);
        } catch (RuntimeException e) {
            LOCK.unlock();
            throw e;
        }
    }

    public Path getDirectory() {
        return directory;
    }

    /** Restores the previous directory and releases the lock. Second call is a no-op. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (previous != null) {
                System.setProperty(USER_DIR, previous);
            } else {
                System.clearProperty(USER_DIR);
            }
        } finally {
            LOCK.unlock();
        }
    }
}
