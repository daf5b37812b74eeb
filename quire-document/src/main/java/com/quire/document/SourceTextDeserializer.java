package com.quire.document;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Deserializes multiline text (cell source, stream text) given either as a single string
 * (e.g. "a = 1\nb = 2") or as an array of line strings (e.g. ["a = 1\n", "b = 2"]).
 */
public final class SourceTextDeserializer extends JsonDeserializer<MultilineText> {

    @Override
    public MultilineText deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return MultilineText.of("");
        }
        if (node.isArray()) {
            List<String> lines = new ArrayList<>(node.size());
            for (JsonNode line : node) {
                lines.add(line.asText(""));
            }
            return MultilineText.ofLines(lines);
        }
        return MultilineText.of(node.asText(""));
    }

    @Override
    public MultilineText getNullValue(DeserializationContext ctxt) {
        return MultilineText.of("");
    }
}
