package io.idlequeue;

import io.idlequeue.model.DeltaUpdate;
import io.idlequeue.model.Notification;
import io.idlequeue.model.NotificationType;
import io.idlequeue.sync.PlayerNotifier;

import java.util.ArrayList;
import java.util.List;

public final class RecordingNotifier implements PlayerNotifier {
    public final List<Notification> notifications = new ArrayList<>();
    public final List<DeltaUpdate> deltas = new ArrayList<>();

    @Override
    public int sendToPlayer(Notification notification) {
        notifications.add(notification);
        return 1;
    }

    @Override
    public int sendDeltaUpdate(DeltaUpdate delta) {
        deltas.add(delta);
        return 1;
    }

    public List<Notification> ofType(NotificationType type) {
        List<Notification> out = new ArrayList<>();
        for (Notification notification : notifications) {
            if (notification.type() == type) {
                out.add(notification);
            }
        }
        return out;
    }

    public List<NotificationType> types() {
        List<NotificationType> out = new ArrayList<>();
        for (Notification notification : notifications) {
            out.add(notification.type());
        }
        return out;
    }
}
