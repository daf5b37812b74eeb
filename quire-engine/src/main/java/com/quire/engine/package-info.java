/**
 * Execution engine contracts and registry. Engines implement {@link com.quire.engine.Engine} and are registered
 * by name with {@link com.quire.engine.EngineRegistry} so a run can select its backend at call time.
 * <ul>
 *   <li>{@link com.quire.engine.Engine} – resolveKernelName(Notebook, hint), execute(Notebook, EngineOptions) → Notebook</li>
 *   <li>{@link com.quire.engine.EngineProvider} – SPI for pluggable discovery (ServiceLoader)</li>
 *   <li>{@link com.quire.engine.EngineRegistry} – name → engine, default engine, provider loading</li>
 *   <li>{@link com.quire.engine.ManagedEngine} / {@link com.quire.engine.ExecutionManager} – per-run start/end times,
 *       durations, cell status, exception flags and incremental saves</li>
 * </ul>
 */
package com.quire.engine;
