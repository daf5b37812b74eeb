package com.quire.parameterize.translate;

import com.quire.document.Notebook;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TranslatorRegistryTest {

    private static Notebook notebook(Map<String, Object> metadata) {
        return new Notebook(List.of(), new LinkedHashMap<>(metadata), 4, 5);
    }

    @Test
    void resolveLanguage_prefersExplicitValue() {
        Notebook nb = notebook(Map.of("kernelspec", Map.of("language", "scala")));

        assertEquals("r", TranslatorRegistry.resolveLanguage(nb, "R"));
    }

    @Test
    void resolveLanguage_fallsBackThroughMetadata() {
        assertEquals("scala", TranslatorRegistry.resolveLanguage(
                notebook(Map.of("kernelspec", Map.of("language", "scala"),
                        "language_info", Map.of("name", "python"))), null));
        assertEquals("bash", TranslatorRegistry.resolveLanguage(
                notebook(Map.of("language_info", Map.of("name", "bash"))), null));
        assertEquals("python", TranslatorRegistry.resolveLanguage(notebook(Map.of()), null));
    }

    @Test
    void get_isCaseInsensitive() {
        TranslatorRegistry registry = TranslatorRegistry.withDefaults();

        assertInstanceOf(PythonTranslator.class, registry.get("Python"));
        assertInstanceOf(RTranslator.class, registry.get("r"));
    }

    @Test
    void get_unknownLanguage() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TranslatorRegistry.getInstance().get("cobol"));
        assertEquals("No parameter translator for language: cobol", e.getMessage());
    }
}
