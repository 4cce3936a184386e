package me.golemcore.gateway.port.outbound;

/**
 * Outbound port for delivering events to the nodes subscribed to one session.
 */
public interface SessionDeliveryPort {

    void sendToSession(String sessionKey, String event, Object payload);
}
