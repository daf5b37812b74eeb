package com.quire.document.load;

import com.quire.document.Notebook;

/**
 * Source of notebooks by reference (e.g. a local path).
 * Implementations must round-trip every field they do not understand.
 */
public interface NotebookSource {

    /**
     * Loads the notebook identified by {@code ref}.
     *
     * @param ref notebook reference (e.g. {@code analysis/input.ipynb})
     * @return the loaded notebook (never null)
     * @throws java.io.UncheckedIOException if the notebook cannot be read or decoded
     */
    Notebook load(String ref);
}
