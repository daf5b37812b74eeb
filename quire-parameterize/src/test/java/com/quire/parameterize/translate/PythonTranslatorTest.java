package com.quire.parameterize.translate;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonTranslatorTest {

    private final PythonTranslator translator = new PythonTranslator();

    @Test
    void translate_scalars() {
        assertEquals("None", translator.translate(null));
        assertEquals("True", translator.translate(true));
        assertEquals("False", translator.translate(false));
        assertEquals("42", translator.translate(42));
        assertEquals("10000000000", translator.translate(10_000_000_000L));
        assertEquals("1.5", translator.translate(1.5));
        assertEquals("0.10", translator.translate(new BigDecimal("0.10")));
        assertEquals("float('nan')", translator.translate(Double.NaN));
        assertEquals("float('-inf')", translator.translate(Double.NEGATIVE_INFINITY));
    }

    @Test
    void translate_escapesStrings() {
        assertEquals("\"plain\"", translator.translate("plain"));
        assertEquals("\"say \\\"hi\\\"\\\\n\\n\"", translator.translate("say \"hi\"\\n\n"));
    }

    @Test
    void translate_nestedCollections() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("k", List.of(1, 2));
        map.put("empty", Map.of());

        assertEquals("{\"k\": [1, 2], \"empty\": {}}", translator.translate(map));
        assertEquals("[1, \"a\", True, None]", translator.translate(Arrays.asList(1, "a", true, null)));
    }

    @Test
    void codifyParameters_keepsInsertionOrder() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("zeta", 1);
        params.put("alpha", "x");

        assertEquals("# Parameters\nzeta = 1\nalpha = \"x\"\n", translator.codifyParameters(params));
    }

    @Test
    void inspect_readsAssignmentsWithHelpAndTypes() {
        String source = """
                # Parameters
                alpha = 0.1  # learning rate
                name: str = "x"
                epochs = 10  # type: int
                """;

        List<ParameterDeclaration> declarations = translator.inspect(source);

        assertEquals(3, declarations.size());
        assertEquals(new ParameterDeclaration("alpha", null, "0.1", "learning rate"), declarations.get(0));
        assertEquals(new ParameterDeclaration("name", "str", "\"x\"", ""), declarations.get(1));
        assertEquals("epochs", declarations.get(2).name());
        assertEquals("int", declarations.get(2).inferredType());
        assertEquals("10", declarations.get(2).defaultValue());
    }

    @Test
    void inspect_joinsMultiLineValues() {
        String source = "items = [\n    1,  # first\n    2,\n]\nafter = True\n";

        List<ParameterDeclaration> declarations = translator.inspect(source);

        assertEquals(2, declarations.size());
        assertEquals("items", declarations.get(0).name());
        assertEquals("[1,2,]", declarations.get(0).defaultValue());
        assertEquals("after", declarations.get(1).name());
    }

    @Test
    void inspect_skipsChainedAssignments() {
        List<ParameterDeclaration> declarations = translator.inspect("a = b = 3\nc = 4\n");

        assertEquals(1, declarations.size());
        assertEquals("c", declarations.get(0).name());
        assertNull(declarations.get(0).inferredType());
    }

    @Test
    void inspect_emptySource() {
        assertTrue(translator.inspect("").isEmpty());
        assertTrue(translator.inspect(null).isEmpty());
    }
}
