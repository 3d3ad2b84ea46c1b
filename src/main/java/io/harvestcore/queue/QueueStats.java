package io.harvestcore.queue;

import io.harvestcore.model.WorkItemStatus;

import java.util.EnumMap;
import java.util.Map;

public record QueueStats(
        String runId,
        Map<WorkItemStatus, Integer> byStatus,
        int total,
        int terminal,
        int remaining
) {
    static QueueStats fromCounts(String runId, Map<String, Integer> raw) {
        Map<WorkItemStatus, Integer> byStatus = new EnumMap<>(WorkItemStatus.class);
        for (WorkItemStatus s : WorkItemStatus.values()) {
            byStatus.put(s, 0);
        }
        int total = 0;
        int terminal = 0;
        for (Map.Entry<String, Integer> e : raw.entrySet()) {
            WorkItemStatus status = WorkItemStatus.fromDb(e.getKey());
            int n = e.getValue();
            byStatus.merge(status, n, Integer::sum);
            total += n;
            if (status.terminal()) {
                terminal += n;
            }
        }
        return new QueueStats(runId, Map.copyOf(byStatus), total, terminal, total - terminal);
    }

    public int count(WorkItemStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public double terminalPct() {
        return total == 0 ? 0d : (terminal * 100d) / total;
    }
}
