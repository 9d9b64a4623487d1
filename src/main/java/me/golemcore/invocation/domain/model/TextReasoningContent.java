package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Reasoning text emitted by models that expose their chain of thought.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TextReasoningContent implements Content {

    public static final String TYPE = "text_reasoning";

    private String text;
    private List<Annotation> annotations;
    private Object rawRepresentation;

    public static TextReasoningContent of(String text) {
        return TextReasoningContent.builder().text(text).build();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    public TextReasoningContent concat(TextReasoningContent other) {
        return TextReasoningContent.builder()
                .text(TextContent.nullToEmpty(text) + TextContent.nullToEmpty(other.getText()))
                .annotations(TextContent.mergeAnnotations(annotations, other.getAnnotations()))
                .rawRepresentation(TextContent.mergeRaw(rawRepresentation, other.getRawRepresentation()))
                .build();
    }
}
