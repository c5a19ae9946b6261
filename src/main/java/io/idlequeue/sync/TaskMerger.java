package io.idlequeue.sync;

import io.idlequeue.model.RewardType;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskReward;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-wise merge of two copies of the same task. The client copy is the base; progress, start time, retry count and
 * completion take whichever side is further along. Rewards are keyed by type and item, keeping the larger quantity.
 */
final class TaskMerger {
    private TaskMerger() {
    }

    static Task merge(Task server, Task client) {
        if (!server.id().equals(client.id())) {
            throw new IllegalArgumentException("Cannot merge different tasks: " + server.id() + " and " + client.id());
        }
        boolean completed = server.completed() || client.completed();
        return new Task(
                client.id(),
                client.name(),
                client.type(),
                client.duration(),
                Math.max(server.startTime(), client.startTime()),
                client.activityData(),
                Math.max(server.progress(), client.progress()),
                completed,
                mergeRewards(server.rewards(), client.rewards()),
                Math.max(server.retryCount(), client.retryCount()),
                client.maxRetries(),
                client.prerequisites(),
                client.resourceRequirements()
        );
    }

    static List<TaskReward> mergeRewards(List<TaskReward> server, List<TaskReward> client) {
        Map<String, TaskReward> merged = new LinkedHashMap<>();
        List<TaskReward> all = new ArrayList<>(server);
        all.addAll(client);
        for (TaskReward reward : all) {
            String key = reward.type().wireName() + ":" + (reward.itemId() == null ? "" : reward.itemId());
            TaskReward existing = merged.get(key);
            if (existing == null) {
                merged.put(key, reward);
            } else {
                RewardType type = existing.type();
                merged.put(key, new TaskReward(type, existing.itemId(), Math.max(existing.quantity(), reward.quantity()),
                        existing.rarity() == null ? reward.rarity() : existing.rarity()));
            }
        }
        return List.copyOf(merged.values());
    }
}
