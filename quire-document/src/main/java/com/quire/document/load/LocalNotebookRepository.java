package com.quire.document.load;

import com.quire.document.Notebook;
import com.quire.document.NotebookJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and stores notebooks as UTF-8 JSON files on the local file system.
 * Relative references resolve against the process working directory.
 */
public final class LocalNotebookRepository implements NotebookSource, NotebookSink {

    private static final Logger log = LoggerFactory.getLogger(LocalNotebookRepository.class);

    @Override
    public Notebook load(String ref) {
        Path file = toPath(ref);
        if (!Files.isRegularFile(file)) {
            throw new UncheckedIOException(new NoSuchFileException(file.toString(), null, "No such notebook file"));
        }
        log.debug("Reading notebook {}", file);
        return NotebookJson.read(file);
    }

    @Override
    public void store(Notebook notebook, String ref) {
        Objects.requireNonNull(notebook, "notebook");
        Path file = toPath(ref);
        log.debug("Writing notebook {}", file);
        NotebookJson.write(notebook, file);
    }

    private static Path toPath(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("Notebook reference must be non-blank");
        }
        return Path.of(ref.trim());
    }
}
