package com.quire.runner;

import com.quire.config.QuireConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionRequestTest {

    @Test
    void builder_defaults() {
        ExecutionRequest request = ExecutionRequest.builder().inputPath(Path.of("in.ipynb")).build();

        assertEquals("in.ipynb", request.getInputPath());
        assertNull(request.getOutputPath());
        assertTrue(request.getParameters().isEmpty());
        assertNull(request.getEngineName());
        assertTrue(request.isRequestSaveOnCellExecute());
        assertEquals(30, request.getAutosaveCellEvery());
        assertFalse(request.isPrepareOnly());
        assertTrue(request.isProgressBar());
        assertFalse(request.isLogOutput());
        assertEquals(60, request.getStartTimeout());
        assertNull(request.getExecutionTimeout());
        assertFalse(request.isReportMode());
        assertTrue(request.isObfuscateSensitiveParameters());
        assertNull(request.getSensitiveParameterPatterns());
    }

    @Test
    void builder_seedsFromConfig() {
        QuireConfig config = QuireConfig.fromMap(Map.of(
                "QUIRE_ENGINE", "remote",
                "QUIRE_START_TIMEOUT_SECONDS", "90",
                "QUIRE_OBFUSCATE_PARAMETERS", "false",
                "QUIRE_SENSITIVE_PATTERNS", "secret,passwd",
                "QUIRE_REPORT_MODE", "true"));

        ExecutionRequest request = ExecutionRequest.builder(config).inputPath("in.ipynb").build();

        assertEquals("remote", request.getEngineName());
        assertEquals(90, request.getStartTimeout());
        assertFalse(request.isObfuscateSensitiveParameters());
        assertEquals(List.of("secret", "passwd"), request.getSensitiveParameterPatterns());
        assertTrue(request.isReportMode());
    }

    @Test
    void parameters_keepInsertionOrder() {
        ExecutionRequest request = ExecutionRequest.builder()
                .inputPath("in.ipynb")
                .parameter("z", 1)
                .parameter("a", 2)
                .parameters(Map.of("m", 3))
                .build();

        assertEquals(List.of("z", "a", "m"), List.copyOf(request.getParameters().keySet()));
    }

    @Test
    void build_requiresInputPath() {
        assertThrows(NullPointerException.class, () -> ExecutionRequest.builder().build());
    }
}
