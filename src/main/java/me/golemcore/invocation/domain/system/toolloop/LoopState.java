package me.golemcore.invocation.domain.system.toolloop;

import me.golemcore.invocation.domain.model.ChatOptions;
import me.golemcore.invocation.domain.model.ChatResponse;
import me.golemcore.invocation.domain.model.Message;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one invocation. Rounds run one after another, so no
 * synchronization is needed.
 */
final class LoopState {

    private List<Message> messages;
    private ChatOptions options;
    private final List<Message> transcript = new ArrayList<>();
    private final Set<String> handledApprovalIds = new HashSet<>();
    private int iteration;
    private int consecutiveErrors;

    LoopState(List<Message> messages, ChatOptions options) {
        this.messages = messages;
        this.options = options;
    }

    List<Message> getMessages() {
        return messages;
    }

    List<Message> snapshot() {
        return new ArrayList<>(messages);
    }

    ChatOptions getOptions() {
        return options;
    }

    void setOptions(ChatOptions options) {
        this.options = options;
    }

    Set<String> getHandledApprovalIds() {
        return handledApprovalIds;
    }

    int nextIteration() {
        return iteration++;
    }

    int getIteration() {
        return iteration;
    }

    int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    /**
     * @return true when the consecutive error limit has been reached
     */
    boolean recordFailedRound(int maxConsecutiveErrors) {
        consecutiveErrors++;
        return consecutiveErrors >= maxConsecutiveErrors;
    }

    void recordSuccessfulRound() {
        consecutiveErrors = 0;
    }

    /**
     * Service-side conversation: from now on only new messages are sent.
     */
    void switchToConversation(String conversationId) {
        options = options.toBuilder().conversationId(conversationId).build();
        messages = new ArrayList<>();
    }

    void recordRound(ChatResponse response, Message toolMessage) {
        transcript.addAll(response.getMessages());
        if (response.getConversationId() != null) {
            messages = new ArrayList<>();
            messages.add(toolMessage);
        } else {
            messages.addAll(response.getMessages());
        }
    }

    /**
     * Puts the messages of earlier rounds in front of the final response.
     */
    ChatResponse withTranscript(ChatResponse response) {
        if (transcript.isEmpty()) {
            return response;
        }
        List<Message> combined = new ArrayList<>(transcript);
        if (response.getMessages() != null) {
            combined.addAll(response.getMessages());
        }
        response.setMessages(combined);
        return response;
    }

    List<Message> getTranscript() {
        return transcript;
    }
}
