package me.golemcore.gateway.domain.service;

/**
 * Null-safe string helpers shared by routing components.
 */
public final class StringValueSupport {

    private StringValueSupport() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
