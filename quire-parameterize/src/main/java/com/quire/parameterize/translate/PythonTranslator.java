package com.quire.parameterize.translate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Python literals. Also the only language with parameters-cell inspection: assignments of the form
 * {@code name = value  # help} or {@code name: type = value}; a value may continue over several lines.
 */
public final class PythonTranslator extends ParameterTranslator {

    private static final Logger log = LoggerFactory.getLogger(PythonTranslator.class);

    private static final Pattern DECLARATION = Pattern.compile(
            "^(?<target>\\w[\\w_]*)\\s*(:\\s*[\"']?(?<annotation>\\w[\\w_\\[\\],\\s]*)[\"']?\\s*)?=\\s*(?<value>.*?)"
                    + "(\\s*#\\s*(type:\\s*(?<typeComment>\\S*)\\s*)?(?<help>.*))?$");

    @Override
    public String getLanguage() {
        return "python";
    }

    @Override
    public String comment(String text) {
        return "# " + text;
    }

    @Override
    protected String translateNull() {
        return "None";
    }

    @Override
    protected String translateBoolean(boolean value) {
        return value ? "True" : "False";
    }

    @Override
    protected String translateFloat(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d)) return "float('nan')";
            if (Double.isInfinite(d)) return d > 0 ? "float('inf')" : "float('-inf')";
        }
        return super.translateFloat(value);
    }

    @Override
    protected String translateMap(Map<?, ?> map) {
        return map.entrySet().stream()
                .map(e -> translateKey(e.getKey()) + ": " + translate(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    protected String translateList(List<?> list) {
        return "[" + joinValues(list, ", ") + "]";
    }

    @Override
    public List<ParameterDeclaration> inspect(String source) {
        List<ParameterDeclaration> declarations = new ArrayList<>();
        if (source == null || source.isBlank()) {
            return declarations;
        }
        List<String> definitions = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        String[] lines = source.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            long equals = line.chars().filter(c -> c == '=').count();
            if (equals > 0) {
                definitions.add(flatten(pending));
                pending.clear();
                if (equals > 1) {
                    log.warn("Unable to parse parameter line {} '{}'", i + 1, line);
                    continue;
                }
            }
            pending.add(line);
        }
        definitions.add(flatten(pending));

        for (String definition : definitions) {
            if (definition.isEmpty()) continue;
            Matcher m = DECLARATION.matcher(definition);
            if (!m.matches()) continue;
            String type = m.group("annotation") != null ? m.group("annotation") : m.group("typeComment");
            String help = m.group("help");
            declarations.add(new ParameterDeclaration(
                    m.group("target").strip(),
                    type == null || type.isBlank() ? null : type.strip(),
                    m.group("value").strip(),
                    help == null ? "" : help.strip()));
        }
        return declarations;
    }

    /** Joins continuation lines; comments are dropped from all but the last line. */
    private static String flatten(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i < lines.size() - 1) {
                int hash = line.indexOf('#');
                sb.append((hash >= 0 ? line.substring(0, hash) : line).strip());
            } else {
                sb.append(line.strip());
            }
        }
        return sb.toString();
    }
}
