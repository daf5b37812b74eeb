package com.quire.engine;

import com.quire.document.Notebook;

import java.time.Clock;

/**
 * Base for engines that want run bookkeeping handled for them. Subclasses implement
 * {@link #executeManaged(ExecutionManager)} and call the manager's cell hooks
 * ({@link ExecutionManager#cellStart}, {@link ExecutionManager#cellException}, {@link ExecutionManager#cellComplete})
 * as they run each cell. Notebook start/complete bookkeeping and the final save are done here; completion is
 * recorded even when execution throws.
 */
public abstract class ManagedEngine implements Engine {

    private final Clock clock;

    protected ManagedEngine() {
        this(Clock.systemUTC());
    }

    protected ManagedEngine(Clock clock) {
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public final Notebook execute(Notebook notebook, EngineOptions options) throws Exception {
        ExecutionManager manager = new ExecutionManager(notebook, options, clock);
        manager.notebookStart();
        try {
            executeManaged(manager);
        } finally {
            manager.notebookComplete();
        }
        return manager.getNotebook();
    }

    /**
     * Runs the notebook's cells. Cell-level errors should be recorded as error outputs and/or via
     * {@link ExecutionManager#cellException}; throw only for engine-level failures.
     */
    protected abstract void executeManaged(ExecutionManager manager) throws Exception;
}
