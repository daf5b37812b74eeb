package com.quire.engine;

import com.quire.config.QuireConfig;
import com.quire.document.Notebook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of execution engines by name. The shared instance ({@link #getInstance()}) is populated at first use
 * from every {@link EngineProvider} visible to {@link ServiceLoader}; engines can also be registered directly.
 * A null or blank engine name selects the registry's default engine.
 */
public final class EngineRegistry {

    private static final Logger log = LoggerFactory.getLogger(EngineRegistry.class);

    private static volatile EngineRegistry instance;

    /** engine name → engine */
    private final Map<String, Engine> engines = new ConcurrentHashMap<>();
    private final String defaultEngineName;

    /**
     * Shared registry; default engine name from {@code QUIRE_ENGINE}, providers loaded with the
     * context class loader on first access.
     */
    public static EngineRegistry getInstance() {
        EngineRegistry local = instance;
        if (local == null) {
            synchronized (EngineRegistry.class) {
                local = instance;
                if (local == null) {
                    local = new EngineRegistry(QuireConfig.fromEnvironment().getEngineName());
                    local.loadProviders(Thread.currentThread().getContextClassLoader());
                    instance = local;
                }
            }
        }
        return local;
    }

    /**
     * Creates an empty registry.
     *
     * @param defaultEngineName engine used when a run names none; null/blank = {@value QuireConfig#DEFAULT_ENGINE}
     */
    public EngineRegistry(String defaultEngineName) {
        this.defaultEngineName = (defaultEngineName != null && !defaultEngineName.isBlank())
                ? defaultEngineName.trim()
                : QuireConfig.DEFAULT_ENGINE;
    }

    /**
     * Registers an engine under the given name.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public void register(String name, Engine engine) {
        Objects.requireNonNull(engine, "engine");
        String key = Objects.requireNonNull(name, "name").trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Engine name must be non-blank");
        }
        if (engines.putIfAbsent(key, engine) != null) {
            throw new IllegalArgumentException("Engine already registered: " + key);
        }
        log.debug("Registered engine {} ({})", key, engine.getClass().getName());
    }

    /**
     * Registers every enabled {@link EngineProvider} found by {@link ServiceLoader} in the given class loader.
     * A provider that fails to load or collides with a registered name is logged and skipped.
     *
     * @return number of engines registered
     */
    public int loadProviders(ClassLoader classLoader) {
        int registered = 0;
        ServiceLoader<EngineProvider> loader = ServiceLoader.load(EngineProvider.class, classLoader);
        List<ServiceLoader.Provider<EngineProvider>> candidates = loader.stream().collect(Collectors.toList());
        for (ServiceLoader.Provider<EngineProvider> candidate : candidates) {
            try {
                EngineProvider provider = candidate.get();
                if (!provider.isEnabled()) {
                    log.info("Engine provider {} is disabled; skipping", provider.getEngineName());
                    continue;
                }
                register(provider.getEngineName(), provider.getEngine());
                registered++;
            } catch (RuntimeException | ServiceConfigurationError e) {
                log.error("Failed to register engine provider {} (skipping): {}", candidate.type().getName(), e.getMessage(), e);
            }
        }
        if (registered > 0) {
            log.info("Loaded {} engine provider(s)", registered);
        }
        return registered;
    }

    public String getDefaultEngineName() {
        return defaultEngineName;
    }

    /**
     * Returns the engine for the given name (null/blank = default engine).
     *
     * @throws NoSuchEngineException if no engine is registered under the resolved name
     */
    public Engine get(String name) {
        String key = resolveName(name);
        Engine engine = engines.get(key);
        if (engine == null) {
            throw new NoSuchEngineException(key);
        }
        return engine;
    }

    /** Delegates kernel-name resolution to the named engine. */
    public String resolveKernelName(String engineName, Notebook notebook, String nameHint) {
        return get(engineName).resolveKernelName(notebook, nameHint);
    }

    /**
     * Executes the notebook with the named engine. Runtime exceptions from the engine propagate unchanged;
     * checked exceptions are wrapped in {@link EngineExecutionException}.
     */
    public Notebook execute(String engineName, Notebook notebook, EngineOptions options) {
        Objects.requireNonNull(notebook, "notebook");
        Objects.requireNonNull(options, "options");
        String key = resolveName(engineName);
        Engine engine = get(key);
        try {
            Notebook result = engine.execute(notebook, options);
            return result != null ? result : notebook;
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineExecutionException(key, "interrupted", e);
        } catch (Exception e) {
            throw new EngineExecutionException(key, e.getMessage(), e);
        }
    }

    /** Read-only view of registered engines by name. */
    public Map<String, Engine> getAll() {
        return Collections.unmodifiableMap(engines);
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        engines.clear();
    }

    private String resolveName(String name) {
        return (name == null || name.isBlank()) ? defaultEngineName : name.trim();
    }
}
