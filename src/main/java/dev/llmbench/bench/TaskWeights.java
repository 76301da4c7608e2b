package dev.llmbench.bench;

import dev.llmbench.catalog.TaskCatalog;
import java.util.List;
import java.util.Map;

/** Fixed per-task-type multipliers used to combine task averages into a run's overall score. */
public final class TaskWeights {
    public static final double DEFAULT_WEIGHT = 1.0;

    private static final Map<String, Double> WEIGHTS =
            Map.of(
                    TaskCatalog.FACTUAL, 1.0,
                    TaskCatalog.REASONING, 1.2,
                    TaskCatalog.CODING, 1.5,
                    TaskCatalog.CREATIVITY, 0.8,
                    TaskCatalog.TOOL_CALLING, 1.0);

    private TaskWeights() {}

    public static double weightOf(String taskType) {
        return WEIGHTS.getOrDefault(taskType, DEFAULT_WEIGHT);
    }

    /** {@code Σ(averageScore * weight) / Σ(weight)}, or 0 with no tasks. */
    public static double overallScore(List<TaskResult> tasks) {
        var weightedSum = 0.0;
        var totalWeight = 0.0;
        for (var task : tasks) {
            var weight = weightOf(task.type());
            weightedSum += task.averageScore() * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? weightedSum / totalWeight : 0;
    }
}
