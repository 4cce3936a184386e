package me.golemcore.gateway.domain.service;

import java.util.Map;

/**
 * Formats run failures for chat clients.
 */
public final class ErrorMessageSupport {

    static final int MAX_LENGTH = 2000;
    private static final String TRUNCATED_SUFFIX = "... [truncated]";

    private ErrorMessageSupport() {
    }

    /**
     * Renders a lifecycle {@code data.error} value: a throwable as
     * {@code Name: message}, a map by its {@code message} entry, anything else
     * by its string form. Returns {@code null} when there is nothing to say.
     */
    public static String format(Object error) {
        String formatted;
        if (error == null) {
            return null;
        } else if (error instanceof Throwable throwable) {
            String message = throwable.getMessage();
            String name = throwable.getClass().getSimpleName();
            formatted = StringValueSupport.isBlank(message) ? name : name + ": " + message;
        } else if (error instanceof Map<?, ?> map) {
            Object message = map.get("message");
            formatted = message != null ? String.valueOf(message) : String.valueOf(map);
        } else {
            formatted = String.valueOf(error);
        }

        String trimmed = formatted.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return truncate(trimmed);
    }

    private static String truncate(String input) {
        if (input.length() <= MAX_LENGTH) {
            return input;
        }
        return input.substring(0, MAX_LENGTH - TRUNCATED_SUFFIX.length()) + TRUNCATED_SUFFIX;
    }
}
