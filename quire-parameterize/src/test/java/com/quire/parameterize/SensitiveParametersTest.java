package com.quire.parameterize;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitiveParametersTest {

    @Test
    void defaults_matchCredentialLikeNames() {
        SensitiveParameters sensitive = SensitiveParameters.defaults();

        assertTrue(sensitive.isSensitive("password"));
        assertTrue(sensitive.isSensitive("DB_PASSWORD"));
        assertTrue(sensitive.isSensitive("api_token"));
        assertTrue(sensitive.isSensitive("key"));
        assertTrue(sensitive.isSensitive("sample_key"));
        assertTrue(sensitive.isSensitive("api_key_id"));
        assertTrue(sensitive.isSensitive("KEY"));
    }

    @Test
    void defaults_doNotMatchKeyInsideAWord() {
        SensitiveParameters sensitive = SensitiveParameters.defaults();

        assertFalse(sensitive.isSensitive("keyword"));
        assertFalse(sensitive.isSensitive("monkey"));
        assertFalse(sensitive.isSensitive("alpha"));
        assertFalse(sensitive.isSensitive(null));
    }

    @Test
    void obfuscateParameter_redactsAnyValueOfSensitiveName() {
        assertEquals(SensitiveParameters.REDACTED, SensitiveParameters.obfuscateParameter("token", "abc"));
        assertEquals(SensitiveParameters.REDACTED, SensitiveParameters.obfuscateParameter("token", ""));
        assertEquals(SensitiveParameters.REDACTED, SensitiveParameters.obfuscateParameter("token", null));
        assertEquals(SensitiveParameters.REDACTED, SensitiveParameters.obfuscateParameter("password", 42));
        assertEquals("********", SensitiveParameters.REDACTED);
    }

    @Test
    void obfuscateParameter_returnsOtherValuesUnchanged() {
        List<Integer> value = List.of(1, 2);

        assertSame(value, SensitiveParameters.obfuscateParameter("alpha", value));
        assertEquals("x", SensitiveParameters.obfuscateParameter("keyword", "x"));
    }

    @Test
    void customPatterns_replaceTheBuiltInSet() {
        List<String> patterns = List.of(".*secret");

        assertEquals("abc", SensitiveParameters.obfuscateParameter("token", "abc", patterns));
        assertEquals(SensitiveParameters.REDACTED, SensitiveParameters.obfuscateParameter("my_secret", "abc", patterns));
    }

    @Test
    void nullPatterns_meanBuiltInSet() {
        assertSame(SensitiveParameters.defaults(), SensitiveParameters.of(null));
        assertEquals(SensitiveParameters.REDACTED, SensitiveParameters.obfuscateParameter("token", "abc", null));
    }

    @Test
    void invalidPattern_isRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SensitiveParameters.of(List.of("(")));
        assertTrue(e.getMessage().contains("("));
    }

    @Test
    void redactAll_keepsOrderAndLeavesInputUntouched() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("b", 1);
        params.put("token", "t");
        params.put("a", "x");

        Map<String, Object> redacted = SensitiveParameters.defaults().redactAll(params);

        assertEquals(List.of("b", "token", "a"), List.copyOf(redacted.keySet()));
        assertEquals(SensitiveParameters.REDACTED, redacted.get("token"));
        assertEquals("t", params.get("token"));
    }
}
