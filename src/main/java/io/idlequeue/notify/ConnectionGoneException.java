package io.idlequeue.notify;

/**
 * The peer behind the connection no longer exists. The connection record should be dropped.
 */
public final class ConnectionGoneException extends NotificationDeliveryException {
    public ConnectionGoneException(String connectionId) {
        super(connectionId, "Connection is gone: " + connectionId, null);
    }
}
