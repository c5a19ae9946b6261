package io.idlequeue.notify;

public class NotificationDeliveryException extends Exception {
    private final String connectionId;

    public NotificationDeliveryException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String connectionId() {
        return connectionId;
    }
}
