package io.idlequeue.sync;

import io.idlequeue.model.DeltaUpdate;
import io.idlequeue.model.Notification;

/**
 * Outbound push to every connection a player has open.
 */
public interface PlayerNotifier {
    int sendToPlayer(Notification notification);

    int sendDeltaUpdate(DeltaUpdate delta);
}
