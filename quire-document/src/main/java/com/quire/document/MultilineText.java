package com.quire.document;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Multiline text as stored in a notebook (cell source, stream text). On disk it is either one string
 * or a list of line strings; the form read is kept so an untouched value is written back unchanged.
 */
public final class MultilineText {

    private final String text;
    private final List<String> lines;

    private MultilineText(String text, List<String> lines) {
        this.text = text;
        this.lines = lines;
    }

    /** Text stored as a single string. */
    public static MultilineText of(String text) {
        return new MultilineText(text != null ? text : "", null);
    }

    /** Text stored as a list of lines, written back exactly as given. */
    public static MultilineText ofLines(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        return new MultilineText(String.join("", lines), List.copyOf(lines));
    }

    /** The joined text. */
    public String getText() {
        return text;
    }

    public boolean isLines() {
        return lines != null;
    }

    @JsonValue
    public Object toJsonValue() {
        return lines != null ? lines : text;
    }

    @Override
    public String toString() {
        return text;
    }
}
