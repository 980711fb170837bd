package buaa.detect.service;

import buaa.detect.dto.EvaluationProgress;
import buaa.detect.model.RunStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 评测进度追踪
 *
 * <p>按运行ID保存进度状态。写操作在每个运行自己的锁内完成，
 * 读操作返回不可变快照，并发写入不会读到中间状态。</p>
 */
@Component
public class ProgressTracker {

    private final Map<Long, ProgressState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProgressTracker() {
        this(Clock.systemUTC());
    }

    ProgressTracker(Clock clock) {
        this.clock = clock;
    }

    public void start(Long runId, int totalSteps) {
        states.computeIfAbsent(runId, id -> new ProgressState(id, clock.instant()))
            .start(totalSteps, clock.instant());
    }

    /**
     * 完成一步：已完成步数加一并更新当前步骤描述
     */
    public void update(Long runId, String stepName) {
        state(runId).update(stepName, clock.instant());
    }

    /**
     * 直接推进到指定步数（只前进不后退）
     */
    public void advanceTo(Long runId, int completedSteps, String stepName) {
        state(runId).advanceTo(completedSteps, stepName, clock.instant());
    }

    public void complete(Long runId) {
        state(runId).complete(clock.instant());
    }

    public void fail(Long runId, String message) {
        state(runId).fail(message, clock.instant());
    }

    public Optional<EvaluationProgress> snapshot(Long runId) {
        ProgressState state = states.get(runId);
        return state == null ? Optional.empty() : Optional.of(state.snapshot());
    }

    public void remove(Long runId) {
        states.remove(runId);
    }

    private ProgressState state(Long runId) {
        return states.computeIfAbsent(runId, id -> new ProgressState(id, clock.instant()));
    }

    private static final class ProgressState {

        private final Long runId;
        private RunStatus status = RunStatus.PENDING;
        private String currentStep = "等待开始";
        private int completedSteps;
        private int totalSteps;
        private String errorMessage;
        private Instant updatedAt;

        private ProgressState(Long runId, Instant now) {
            this.runId = runId;
            this.updatedAt = now;
        }

        synchronized void start(int total, Instant now) {
            this.totalSteps = Math.max(0, total);
            this.completedSteps = 0;
            this.status = RunStatus.PROCESSING;
            this.currentStep = "评测开始";
            this.errorMessage = null;
            this.updatedAt = now;
        }

        synchronized void update(String stepName, Instant now) {
            if (status.isTerminal()) {
                return;
            }
            this.completedSteps++;
            this.currentStep = stepName;
            this.updatedAt = now;
        }

        synchronized void advanceTo(int completed, String stepName, Instant now) {
            if (status.isTerminal()) {
                return;
            }
            this.completedSteps = Math.max(this.completedSteps, completed);
            this.currentStep = stepName;
            this.updatedAt = now;
        }

        synchronized void complete(Instant now) {
            if (status.isTerminal()) {
                return;
            }
            this.status = RunStatus.COMPLETED;
            this.completedSteps = totalSteps;
            this.currentStep = "评测完成";
            this.updatedAt = now;
        }

        synchronized void fail(String message, Instant now) {
            if (status.isTerminal()) {
                return;
            }
            this.status = RunStatus.FAILED;
            this.errorMessage = message;
            this.currentStep = "评测失败";
            this.updatedAt = now;
        }

        synchronized EvaluationProgress snapshot() {
            return new EvaluationProgress(runId, status, currentStep, completedSteps,
                totalSteps, errorMessage, updatedAt);
        }
    }
}
