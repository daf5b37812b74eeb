package com.quire.engine;

/**
 * SPI for pluggable engines. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.quire.engine.EngineProvider) and registered by name in {@link EngineRegistry}.
 */
public interface EngineProvider {

    /** Engine name used to select it at call time (e.g. "default", "local-process"). */
    String getEngineName();

    /** Engine instance; engines are shared across runs and must be thread-safe. */
    Engine getEngine();

    /**
     * Whether this provider should be registered. Override to skip registration when the backend is unavailable
     * (e.g. a required executable is missing).
     */
    default boolean isEnabled() {
        return true;
    }
}
