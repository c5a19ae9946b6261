package io.idlequeue.engine;

import io.idlequeue.model.DeltaType;
import io.idlequeue.model.DeltaUpdate;
import io.idlequeue.model.Notification;
import io.idlequeue.model.NotificationType;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskQueue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class QueueEvents {
    private QueueEvents() {
    }

    static Map<String, Object> summary(TaskQueue queue) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", queue.version());
        out.put("checksum", queue.checksum());
        out.put("isRunning", queue.running());
        out.put("isPaused", queue.paused());
        out.put("currentTaskId", queue.currentTask() == null ? null : queue.currentTask().id());
        List<String> queued = new ArrayList<>();
        for (Task task : queue.queuedTasks()) {
            queued.add(task.id());
        }
        out.put("queuedTaskIds", queued);
        out.put("totalTasksCompleted", queue.totalTasksCompleted());
        out.put("totalTimeSpent", queue.totalTimeSpent());
        return out;
    }

    static Notification queueUpdated(TaskQueue queue, long nowMs) {
        return Notification.of(NotificationType.QUEUE_UPDATED, queue.playerId(), null, summary(queue), nowMs);
    }

    static Notification taskStarted(TaskQueue queue, long nowMs) {
        Task task = queue.currentTask();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task", task);
        data.put("estimatedCompletion", task.startTime() + task.duration());
        return Notification.of(NotificationType.TASK_STARTED, queue.playerId(), task.id(), data, nowMs);
    }

    static DeltaUpdate delta(DeltaType type, TaskQueue queue, String taskId, Map<String, Object> data, long nowMs) {
        return new DeltaUpdate(type, queue.playerId(), taskId, data, nowMs, queue.version(), queue.checksum());
    }

    static DeltaUpdate stateChanged(TaskQueue queue, long nowMs) {
        return delta(DeltaType.QUEUE_STATE_CHANGED, queue, null, summary(queue), nowMs);
    }
}
