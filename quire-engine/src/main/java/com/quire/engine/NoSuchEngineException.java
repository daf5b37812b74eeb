package com.quire.engine;

/**
 * Thrown when a run names an engine that is not registered.
 */
public final class NoSuchEngineException extends RuntimeException {

    private final String engineName;

    public NoSuchEngineException(String engineName) {
        super("No engine named '" + engineName + "' found.");
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
