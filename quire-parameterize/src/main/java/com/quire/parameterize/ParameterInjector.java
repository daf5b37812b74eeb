package com.quire.parameterize;

import com.quire.document.Cell;
import com.quire.document.Notebook;
import com.quire.parameterize.translate.ParameterTranslator;
import com.quire.parameterize.translate.TranslatorRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes parameter values into a notebook's {@code parameters} cell, creating the cell at the top when
 * the notebook has none, and records the values under {@code metadata.quire.parameters}.
 */
public final class ParameterInjector {

    public static final String PARAMETERS_TAG = "parameters";

    private final TranslatorRegistry translators;

    public ParameterInjector() {
        this(TranslatorRegistry.getInstance());
    }

    public ParameterInjector(TranslatorRegistry translators) {
        this.translators = Objects.requireNonNull(translators, "translators");
    }

    /** Injects with the notebook's own language (python when the metadata does not say). */
    public Notebook inject(Notebook notebook, Map<String, Object> parameters, boolean reportMode,
                           boolean obfuscate, List<String> sensitivePatterns) {
        return inject(notebook, parameters, reportMode, obfuscate, sensitivePatterns, null);
    }

    /**
     * Rewrites the parameters cell in place.
     *
     * @param sensitivePatterns name patterns for redaction; null = built-in set
     * @param language          kernel language override; null = from notebook metadata
     * @return the same notebook
     */
    public Notebook inject(Notebook notebook, Map<String, Object> parameters, boolean reportMode,
                           boolean obfuscate, List<String> sensitivePatterns, String language) {
        Objects.requireNonNull(notebook, "notebook");
        Objects.requireNonNull(parameters, "parameters");

        Map<String, Object> resolved = obfuscate
                ? SensitiveParameters.of(sensitivePatterns).redactAll(parameters)
                : new LinkedHashMap<>(parameters);
        ParameterTranslator translator = translators.forNotebook(notebook, language);
        String source = translator.codifyParameters(resolved);

        Cell cell = findParametersCell(notebook);
        if (cell == null) {
            cell = Cell.code(source);
            cell.addTag(PARAMETERS_TAG);
            notebook.addCell(0, cell);
        } else {
            cell.setSource(source);
            cell.setOutputs(List.of());
            cell.setExecutionCount(null);
        }

        notebook.namespace().put(Notebook.PARAMETERS, recordable(resolved));
        if (reportMode) {
            hideCodeSources(notebook);
        }
        return notebook;
    }

    /**
     * Copy of a parameter value fit for the JSON metadata record: non-finite floats, which JSON has no
     * number for, become the strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"}.
     */
    static Object recordable(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? value : Double.toString(d);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, recordable(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(recordable(v)));
            return copy;
        }
        return value;
    }

    /** First code cell tagged {@value #PARAMETERS_TAG}, or null. */
    public static Cell findParametersCell(Notebook notebook) {
        for (Cell cell : notebook.getCells()) {
            if (cell.isCode() && cell.hasTag(PARAMETERS_TAG)) {
                return cell;
            }
        }
        return null;
    }

    /** Supplied names that are not declared, in supplied order. */
    public static List<String> unknownParameters(Set<String> declared, Map<String, ?> supplied) {
        List<String> unknown = new ArrayList<>();
        for (String name : supplied.keySet()) {
            if (!declared.contains(name)) {
                unknown.add(name);
            }
        }
        return unknown;
    }

    /** Sets {@code metadata.jupyter.source_hidden} on every code cell. */
    @SuppressWarnings("unchecked")
    public static void hideCodeSources(Notebook notebook) {
        for (Cell cell : notebook.getCells()) {
            if (!cell.isCode()) continue;
            Object jupyter = cell.getMetadata().get("jupyter");
            Map<String, Object> section;
            if (jupyter instanceof Map<?, ?>) {
                section = (Map<String, Object>) jupyter;
            } else {
                section = new LinkedHashMap<>();
                cell.getMetadata().put("jupyter", section);
            }
            section.put("source_hidden", true);
        }
    }
}
