package io.idlequeue;

import io.idlequeue.notify.ConnectionGoneException;
import io.idlequeue.notify.NotificationChannel;
import io.idlequeue.notify.NotificationDeliveryException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class RecordingChannel implements NotificationChannel {
    public final Map<String, List<String>> sent = new LinkedHashMap<>();
    public final Set<String> failing = new HashSet<>();
    public final Set<String> gone = new HashSet<>();

    @Override
    public void send(String connectionId, String payload) throws NotificationDeliveryException {
        if (gone.contains(connectionId)) {
            throw new ConnectionGoneException(connectionId);
        }
        if (failing.contains(connectionId)) {
            throw new NotificationDeliveryException(connectionId, "simulated failure", null);
        }
        sent.computeIfAbsent(connectionId, k -> new ArrayList<>()).add(payload);
    }

    public List<String> to(String connectionId) {
        return sent.getOrDefault(connectionId, List.of());
    }
}
