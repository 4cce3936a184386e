package me.golemcore.gateway.domain.model;

/**
 * Event names used on the gateway transports.
 */
public final class GatewayEvents {

    /** Raw run events (lifecycle, assistant, tool, error). */
    public static final String AGENT = "agent";

    /** Chat projection (delta, final, error). */
    public static final String CHAT = "chat";

    private GatewayEvents() {
    }
}
