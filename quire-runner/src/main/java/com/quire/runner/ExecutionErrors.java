package com.quire.runner;

import com.quire.document.Cell;
import com.quire.document.Notebook;
import com.quire.document.load.NotebookSink;
import com.quire.document.output.ErrorOutput;
import com.quire.document.output.Output;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the first failed cell of an executed notebook. Error outputs decide; a cell's
 * {@code quire.exception} flag counts only when the cell has no error output and did not exit
 * cleanly. {@code SystemExit} with an empty or zero code is a clean exit.
 */
public final class ExecutionErrors {

    private static final Logger log = LoggerFactory.getLogger(ExecutionErrors.class);

    static final String SYSTEM_EXIT = "SystemExit";
    static final String CELL_EXECUTION_ERROR = "CellExecutionError";

    private ExecutionErrors() {
    }

    public static Optional<NotebookExecutionException> find(Notebook notebook) {
        List<Cell> cells = notebook.getCells();
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            boolean cleanExit = false;
            for (Output output : cell.getOutputs()) {
                if (!(output instanceof ErrorOutput error)) {
                    continue;
                }
                if (isCleanExit(error)) {
                    cleanExit = true;
                    continue;
                }
                return Optional.of(new NotebookExecutionException(i, cell.getExecutionCount(), cell.getSource(),
                        error.getEname(), error.getEvalue(), error.getTraceback()));
            }
            if (!cleanExit && flaggedAsFailed(cell)) {
                return Optional.of(new NotebookExecutionException(i, cell.getExecutionCount(), cell.getSource(),
                        CELL_EXECUTION_ERROR, "", List.of()));
            }
        }
        return Optional.empty();
    }

    /**
     * Throws the first failure after marking the notebook and, when {@code outputRef} is set, saving it
     * so the marked copy is on disk before the caller sees the exception. No failure: no change.
     */
    public static void raiseForExecutionErrors(Notebook notebook, String outputRef, NotebookSink sink) {
        Optional<NotebookExecutionException> failure = find(notebook);
        if (failure.isEmpty()) {
            return;
        }
        NotebookExecutionException error = failure.get();
        ErrorMarkers.mark(notebook, error);
        if (outputRef != null) {
            sink.store(notebook, outputRef);
        }
        log.info("Notebook failed at cell {} ({}: {})", error.getCellIndex(), error.getEname(), error.getEvalue());
        throw error;
    }

    private static boolean isCleanExit(ErrorOutput error) {
        return SYSTEM_EXIT.equals(error.getEname())
                && ("".equals(error.getEvalue()) || "0".equals(error.getEvalue()));
    }

    private static boolean flaggedAsFailed(Cell cell) {
        Object ns = cell.getMetadata().get(Notebook.NAMESPACE);
        return ns instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get(Notebook.EXCEPTION));
    }
}
