package io.idlequeue.notify;

/**
 * Point-to-point push of a serialized notification to one client connection.
 */
public interface NotificationChannel {
    void send(String connectionId, String payload) throws NotificationDeliveryException;
}
