package me.golemcore.gateway.domain.model;

/**
 * Per-delivery transport hints. With {@code dropIfSlow} a transport skips
 * connections whose outbound buffer is full instead of treating them as failed.
 */
public record DeliveryOptions(boolean dropIfSlow) {

    public static final DeliveryOptions DEFAULT = new DeliveryOptions(false);
    public static final DeliveryOptions DROP_IF_SLOW = new DeliveryOptions(true);
}
