package com.quire.engine;

/**
 * Engine-level failure (kernel startup, timeout, transport). Aborts the run; the notebook is not classified
 * or persisted by the runner afterwards.
 */
public final class EngineExecutionException extends RuntimeException {

    private final String engineName;

    public EngineExecutionException(String engineName, String message, Throwable cause) {
        super("Engine '" + engineName + "' failed: " + message, cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
