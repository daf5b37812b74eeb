package com.quire.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialization and deserialization of notebooks (nbformat 4 JSON).
 * Only explicitly annotated members are mapped; nulls are written (nbformat uses them, e.g. {@code execution_count}).
 */
public final class NotebookJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.NONE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private NotebookJson() {
    }

    /**
     * Deserializes a notebook from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static Notebook fromJson(String json) {
        try {
            return MAPPER.readValue(json, Notebook.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the notebook to pretty-printed JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Notebook notebook) {
        try {
            return MAPPER.writeValueAsString(notebook);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Reads a UTF-8 notebook file. */
    public static Notebook read(Path file) {
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read notebook " + file, e);
        }
    }

    /** Writes the notebook as UTF-8 JSON, creating parent directories as needed. */
    public static void write(Notebook notebook, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(notebook) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write notebook " + file, e);
        }
    }

    /** Deep copy through JSON; the copy shares no mutable state with the original. */
    public static Notebook copy(Notebook notebook) {
        return fromJson(toJson(notebook));
    }
}
