package com.quire.document.output;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One output record of a code cell. Decoded once at load time by {@code output_type}:
 * {@link ErrorOutput}, {@link StreamOutput}, and {@link DataOutput} for every other kind.
 * Fields a variant does not model are kept and written back unchanged.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "output_type",
        visible = true,
        defaultImpl = DataOutput.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ErrorOutput.class, name = "error"),
        @JsonSubTypes.Type(value = StreamOutput.class, name = "stream")
})
public abstract class Output {

    private final String outputTypeName;
    private final Map<String, Object> other = new LinkedHashMap<>();

    protected Output(String outputTypeName) {
        this.outputTypeName = outputTypeName;
    }

    @JsonProperty("output_type")
    public String getOutputTypeName() {
        return outputTypeName;
    }

    public OutputType getType() {
        return OutputType.fromValue(outputTypeName);
    }

    /** Fields not modelled by the concrete variant; mutable. */
    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    @JsonAnySetter
    protected void putOther(String key, Object value) {
        other.put(key, value);
    }
}
