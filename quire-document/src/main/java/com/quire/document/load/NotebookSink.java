package com.quire.document.load;

import com.quire.document.Notebook;

/**
 * Destination for notebooks by reference. Called at the end of a run, on failure with error markers,
 * and by engines that save after each cell.
 */
public interface NotebookSink {

    /**
     * Persists the notebook under {@code ref}, replacing any previous content.
     *
     * @param notebook notebook to store
     * @param ref      destination reference (e.g. {@code out/output.ipynb})
     * @throws java.io.UncheckedIOException if the notebook cannot be written
     */
    void store(Notebook notebook, String ref);
}
