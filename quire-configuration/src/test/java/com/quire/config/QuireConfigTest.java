package com.quire.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuireConfigTest {

    @Test
    void fromMap_emptyEnvironmentUsesDefaults() {
        QuireConfig config = QuireConfig.fromMap(Map.of());

        assertEquals(QuireConfig.DEFAULT_ENGINE, config.getEngineName());
        assertEquals(60, config.getStartTimeoutSeconds());
        assertNull(config.getExecutionTimeoutSeconds());
        assertTrue(config.isObfuscateSensitiveParameters());
        assertNull(config.getSensitiveParameterPatterns());
        assertFalse(config.isReportMode());
        assertTrue(config.isProgressBar());
        assertFalse(config.isLogOutput());
        assertEquals(30, config.getAutosaveSeconds());
        assertEquals(3, config.getIoRetries());
    }

    @Test
    void fromMap_readsEveryKey() {
        QuireConfig config = QuireConfig.fromMap(Map.of(
                "QUIRE_ENGINE", " local ",
                "QUIRE_START_TIMEOUT_SECONDS", "120",
                "QUIRE_EXECUTION_TIMEOUT_SECONDS", "600",
                "QUIRE_OBFUSCATE_PARAMETERS", "false",
                "QUIRE_SENSITIVE_PATTERNS", ".*secret, .*credential ,",
                "QUIRE_REPORT_MODE", "1",
                "QUIRE_PROGRESS_BAR", "FALSE",
                "QUIRE_LOG_OUTPUT", "true",
                "QUIRE_AUTOSAVE_SECONDS", "5",
                "QUIRE_IO_RETRIES", "7"));

        assertEquals("local", config.getEngineName());
        assertEquals(120, config.getStartTimeoutSeconds());
        assertEquals(600, config.getExecutionTimeoutSeconds());
        assertFalse(config.isObfuscateSensitiveParameters());
        assertEquals(List.of(".*secret", ".*credential"), config.getSensitiveParameterPatterns());
        assertTrue(config.isReportMode());
        assertFalse(config.isProgressBar());
        assertTrue(config.isLogOutput());
        assertEquals(5, config.getAutosaveSeconds());
        assertEquals(7, config.getIoRetries());
    }

    @Test
    void fromMap_invalidValuesFallBackToDefaults() {
        QuireConfig config = QuireConfig.fromMap(Map.of(
                "QUIRE_START_TIMEOUT_SECONDS", "soon",
                "QUIRE_OBFUSCATE_PARAMETERS", "maybe",
                "QUIRE_IO_RETRIES", "0"));

        assertEquals(60, config.getStartTimeoutSeconds());
        assertTrue(config.isObfuscateSensitiveParameters());
        assertEquals(1, config.getIoRetries());
    }
}
