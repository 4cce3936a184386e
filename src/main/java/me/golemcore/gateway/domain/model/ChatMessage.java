package me.golemcore.gateway.domain.model;

import java.util.List;

/**
 * Assistant message carried by chat delta and final events.
 */
public record ChatMessage(String role, List<ChatContent> content, long timestamp) {

    public static ChatMessage assistantText(String text, long timestamp) {
        return new ChatMessage("assistant", List.of(ChatContent.text(text)), timestamp);
    }
}
