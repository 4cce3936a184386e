package me.golemcore.gateway.domain.model;

/**
 * Single content block of a chat message.
 */
public record ChatContent(String type, String text) {

    public static ChatContent text(String text) {
        return new ChatContent("text", text);
    }
}
