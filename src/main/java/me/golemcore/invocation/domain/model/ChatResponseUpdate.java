package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One fragment of a streamed response.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponseUpdate {

    @Builder.Default
    private List<Content> contents = new ArrayList<>();

    private String role;
    private String messageId;
    private String authorName;
    private String responseId;
    private String conversationId;
    private String modelId;
    private FinishReason finishReason;
    private Instant createdAt;
    private Map<String, Object> additionalProperties;
    private Object rawRepresentation;

    public static ChatResponseUpdate of(String role, List<? extends Content> contents) {
        return ChatResponseUpdate.builder()
                .role(role)
                .contents(new ArrayList<>(contents))
                .build();
    }

    public static ChatResponseUpdate text(String text) {
        return of(Message.ROLE_ASSISTANT, List.of(TextContent.of(text)));
    }

    public String getText() {
        if (contents == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Content content : contents) {
            if (content instanceof TextContent textContent && textContent.getText() != null) {
                sb.append(textContent.getText());
            }
        }
        return sb.toString();
    }
}
