package com.quire.engine;

import com.quire.document.Notebook;

/**
 * Execution backend: runs a notebook's code cells against a kernel and returns the notebook with outputs,
 * execution counts and per-cell metadata populated. May return a partially run notebook.
 * <p>
 * Timeouts, output capture and per-cell saving are requested through {@link EngineOptions}; enforcing them
 * is the engine's job. Startup failures and timeouts surface as exceptions (typically
 * {@link EngineExecutionException}); cell-level errors are reported as error outputs or the cell's
 * {@code quire.exception} metadata flag, not thrown.
 */
public interface Engine {

    /**
     * Resolves the kernel to run against. Default: {@code nameHint} when set, otherwise the notebook's
     * {@code metadata.kernelspec.name}.
     *
     * @throws IllegalArgumentException when neither is available
     */
    default String resolveKernelName(Notebook notebook, String nameHint) {
        if (nameHint != null && !nameHint.isBlank()) {
            return nameHint.trim();
        }
        String fromNotebook = notebook.metadataString("kernelspec.name");
        if (fromNotebook == null || fromNotebook.isBlank()) {
            throw new IllegalArgumentException("No kernel name found in notebook and no override provided.");
        }
        return fromNotebook;
    }

    /**
     * Executes the notebook.
     *
     * @param notebook notebook to run; engines may mutate and return it
     * @param options  run options; never null
     * @return the executed notebook
     * @throws Exception on engine failure (kernel startup, timeout, transport)
     */
    Notebook execute(Notebook notebook, EngineOptions options) throws Exception;
}
