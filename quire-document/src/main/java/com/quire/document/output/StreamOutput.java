package com.quire.document.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.quire.document.MultilineText;
import com.quire.document.SourceTextDeserializer;

/** Stream output ({@code stdout} / {@code stderr}) with its text. */
@JsonPropertyOrder({"output_type", "name", "text"})
public final class StreamOutput extends Output {

    private final String name;
    private final MultilineText text;

    @JsonCreator
    public StreamOutput(
            @JsonProperty("output_type") String outputTypeName,
            @JsonProperty("name") String name,
            @JsonProperty("text") @JsonDeserialize(using = SourceTextDeserializer.class) MultilineText text) {
        super(OutputType.STREAM.getValue());
        this.name = name;
        this.text = text != null ? text : MultilineText.of("");
    }

    public StreamOutput(String name, String text) {
        this(OutputType.STREAM.getValue(), name, MultilineText.of(text));
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    public String getText() {
        return text.getText();
    }

    @JsonProperty("text")
    MultilineText textValue() {
        return text;
    }
}
