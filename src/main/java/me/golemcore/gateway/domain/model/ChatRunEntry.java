package me.golemcore.gateway.domain.model;

/**
 * Pending chat request bound to a session: the session that asked and the run
 * id the requesting client uses to correlate chat events.
 */
public record ChatRunEntry(String sessionKey, String clientRunId) {
}
