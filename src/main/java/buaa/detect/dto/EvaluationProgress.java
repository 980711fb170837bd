package buaa.detect.dto;

import buaa.detect.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 评测进度的不可变快照
 */
@Getter
@ToString
@AllArgsConstructor
public final class EvaluationProgress {

    private final Long runId;
    private final RunStatus status;
    private final String currentStep;
    private final int completedSteps;
    private final int totalSteps;
    private final String errorMessage;
    private final Instant updatedAt;

    /**
     * min(100, floor(completed / total * 100))，总步数为0时为0
     */
    public int getProgressPercentage() {
        if (totalSteps <= 0) {
            return 0;
        }
        return (int) Math.min(100, Math.floor((double) completedSteps / totalSteps * 100));
    }

    public static EvaluationProgress pending(Long runId) {
        return new EvaluationProgress(runId, RunStatus.PENDING, "等待开始", 0, 0, null, Instant.now());
    }
}
