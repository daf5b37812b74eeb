package com.quire.engine;

import com.quire.document.Cell;
import com.quire.document.Notebook;
import com.quire.document.load.NotebookSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Pre/post execution bookkeeping for one run of a {@link ManagedEngine}: stamps start/end times, durations,
 * status and the exception flag into the {@code quire} metadata namespace of the notebook and its cells,
 * and saves the notebook to the output path as cells complete.
 * <p>
 * Single-threaded: the engine calls the hooks in order from the thread running the notebook.
 */
public final class ExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(ExecutionManager.class);

    static final String START_TIME = "start_time";
    static final String END_TIME = "end_time";
    static final String DURATION = "duration";
    static final String STATUS = "status";

    private final Notebook notebook;
    private final EngineOptions options;
    private final Clock clock;
    private Instant lastSave;

    public ExecutionManager(Notebook notebook, EngineOptions options, Clock clock) {
        this.notebook = Objects.requireNonNull(notebook, "notebook");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Notebook getNotebook() {
        return notebook;
    }

    public EngineOptions getOptions() {
        return options;
    }

    /** Resets run bookkeeping on the notebook and every cell, clears code outputs, then saves. */
    public void notebookStart() {
        Map<String, Object> ns = notebook.namespace();
        ns.put(START_TIME, now().toString());
        ns.put(END_TIME, null);
        ns.put(DURATION, null);
        ns.put(Notebook.EXCEPTION, null);

        for (Cell cell : notebook.getCells()) {
            Map<String, Object> cellNs = cell.namespace();
            cellNs.clear();
            cellNs.put(Notebook.EXCEPTION, null);
            cellNs.put(START_TIME, null);
            cellNs.put(END_TIME, null);
            cellNs.put(DURATION, null);
            cellNs.put(STATUS, CellStatus.PENDING.getValue());
            if (cell.isCode()) {
                cell.setOutputs(new ArrayList<>());
                cell.setExecutionCount(null);
            }
        }
        save();
    }

    /** Marks the cell running and saves. */
    public void cellStart(Cell cell, int index) {
        if (options.isLogOutput()) {
            log.info("Executing cell {} of {}", index + 1, notebook.size());
        }
        Map<String, Object> cellNs = cell.namespace();
        cellNs.put(START_TIME, now().toString());
        cellNs.put(STATUS, CellStatus.RUNNING.getValue());
        cellNs.put(Notebook.EXCEPTION, false);
        save();
    }

    /** Flags the cell (and the notebook) as having raised an exception. */
    public void cellException(Cell cell, int index) {
        log.debug("Cell {} raised an exception", index);
        Map<String, Object> cellNs = cell.namespace();
        cellNs.put(Notebook.EXCEPTION, true);
        cellNs.put(STATUS, CellStatus.FAILED.getValue());
        notebook.namespace().put(Notebook.EXCEPTION, true);
    }

    /** Stamps end time and duration, marks the cell completed unless it failed, then saves. */
    public void cellComplete(Cell cell, int index) {
        Instant end = now();
        Map<String, Object> cellNs = cell.namespace();
        cellNs.put(END_TIME, end.toString());
        cellNs.put(DURATION, secondsBetween(cellNs.get(START_TIME), end));
        if (CellStatus.fromValue(cellNs.get(STATUS)) != CellStatus.FAILED) {
            cellNs.put(STATUS, CellStatus.COMPLETED.getValue());
        }
        if (options.isLogOutput()) {
            log.info("Finished cell {} with status {}", index + 1, cellNs.get(STATUS));
        }
        save();
    }

    /**
     * Stamps notebook end time and duration and records whether any cell failed. Cells left pending before the
     * first failed cell are marked completed (engines that do not report every cell). Saves.
     */
    public void notebookComplete() {
        Instant end = now();
        Map<String, Object> ns = notebook.namespace();
        ns.put(END_TIME, end.toString());
        ns.put(DURATION, secondsBetween(ns.get(START_TIME), end));

        boolean failed = false;
        for (Cell cell : notebook.getCells()) {
            Map<String, Object> cellNs = cell.namespace();
            CellStatus status = CellStatus.fromValue(cellNs.get(STATUS));
            if (status == CellStatus.FAILED) {
                failed = true;
                break;
            }
            if (status == CellStatus.PENDING) {
                cellNs.put(STATUS, CellStatus.COMPLETED.getValue());
            }
        }
        ns.put(Notebook.EXCEPTION, failed);
        save();
    }

    /** Saves the notebook to the output path; no-op when the run has no output path or sink. */
    public void save() {
        String outputPath = options.getOutputPath();
        NotebookSink sink = options.getSink();
        if (outputPath == null || sink == null) {
            return;
        }
        sink.store(notebook, outputPath);
        lastSave = now();
    }

    /**
     * Saves when at least the autosave interval has passed since the last save. For engines that stream
     * outputs during a long-running cell.
     *
     * @return true if a save happened
     */
    public boolean autosave() {
        Duration interval = options.getAutosaveInterval();
        if (interval.isZero() || interval.isNegative()) {
            return false;
        }
        Instant current = now();
        if (lastSave != null && Duration.between(lastSave, current).compareTo(interval) < 0) {
            return false;
        }
        save();
        return lastSave != null;
    }

    private Instant now() {
        return clock.instant();
    }

    private static Double secondsBetween(Object start, Instant end) {
        if (!(start instanceof String)) {
            return null;
        }
        try {
            Duration d = Duration.between(Instant.parse((String) start), end);
            return d.toMillis() / 1000.0;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable start_time {}; duration not recorded", start);
            return null;
        }
    }
}
