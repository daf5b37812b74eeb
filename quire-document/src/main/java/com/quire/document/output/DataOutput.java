package com.quire.document.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Any output that is neither an error nor a stream (execute_result, display_data, ...).
 * All of its fields live in {@link #getOther()}.
 */
public final class DataOutput extends Output {

    @JsonCreator
    public DataOutput(@JsonProperty("output_type") String outputTypeName) {
        super(outputTypeName);
    }

    /** Builds an output of the given type with the given fields (e.g. {@code data}, {@code metadata}). */
    public static DataOutput of(String outputTypeName, Map<String, Object> fields) {
        DataOutput out = new DataOutput(outputTypeName);
        if (fields != null) {
            fields.forEach(out::putOther);
        }
        return out;
    }
}
