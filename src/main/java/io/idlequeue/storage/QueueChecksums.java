package io.idlequeue.storage;

import io.idlequeue.model.Task;
import io.idlequeue.model.TaskQueue;
import io.idlequeue.util.Hashing;
import io.idlequeue.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SHA-256 fingerprint of the queue state clients compare against: version, current task, queued ids and flags.
 */
public final class QueueChecksums {
    private QueueChecksums() {
    }

    public static String checksum(TaskQueue queue) {
        Map<String, Object> basis = new LinkedHashMap<>();
        basis.put("version", queue.version());
        Task current = queue.currentTask();
        basis.put("currentTaskId", current == null ? null : current.id());
        basis.put("currentTaskStartTime", current == null ? null : current.startTime());
        basis.put("currentTaskRetryCount", current == null ? null : current.retryCount());
        List<String> queuedIds = new ArrayList<>();
        for (Task task : queue.queuedTasks()) {
            queuedIds.add(task.id());
        }
        basis.put("queuedTaskIds", queuedIds);
        basis.put("isRunning", queue.running());
        basis.put("isPaused", queue.paused());
        basis.put("totalTasksCompleted", queue.totalTasksCompleted());
        return Hashing.sha256Hex(Jsons.toCompactJson(basis));
    }

    public static boolean matches(TaskQueue queue) {
        return checksum(queue).equals(queue.checksum());
    }
}
