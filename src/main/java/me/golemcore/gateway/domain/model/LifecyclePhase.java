package me.golemcore.gateway.domain.model;

/**
 * Phases carried in {@code data.phase} of lifecycle stream events.
 */
public final class LifecyclePhase {

    public static final String START = "start";
    public static final String END = "end";
    public static final String ERROR = "error";

    private LifecyclePhase() {
    }

    public static boolean isTerminal(String phase) {
        return END.equals(phase) || ERROR.equals(phase);
    }
}
