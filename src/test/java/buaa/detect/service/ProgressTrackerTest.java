package buaa.detect.service;

import buaa.detect.dto.EvaluationProgress;
import buaa.detect.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
    private final ProgressTracker tracker = new ProgressTracker(clock);

    @Test
    void percentageFollowsCompletedSteps() {
        tracker.start(1L, 3);
        tracker.update(1L, "第一步");

        EvaluationProgress progress = tracker.snapshot(1L).orElseThrow();

        assertThat(progress.getStatus()).isEqualTo(RunStatus.PROCESSING);
        assertThat(progress.getCompletedSteps()).isEqualTo(1);
        assertThat(progress.getProgressPercentage()).isEqualTo(33);
        assertThat(progress.getCurrentStep()).isEqualTo("第一步");
        assertThat(progress.getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void advanceToNeverMovesBackwards() {
        tracker.start(2L, 100);
        tracker.advanceTo(2L, 40, "推理");
        tracker.advanceTo(2L, 20, "回退");

        assertThat(tracker.snapshot(2L).orElseThrow().getCompletedSteps()).isEqualTo(40);
    }

    @Test
    void completeFillsAllStepsAndIgnoresLaterWrites() {
        tracker.start(3L, 10);
        tracker.complete(3L);
        tracker.update(3L, "迟到的更新");
        tracker.fail(3L, "迟到的失败");

        EvaluationProgress progress = tracker.snapshot(3L).orElseThrow();
        assertThat(progress.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(progress.getProgressPercentage()).isEqualTo(100);
        assertThat(progress.getErrorMessage()).isNull();
    }

    @Test
    void failRecordsMessage() {
        tracker.start(4L, 10);
        tracker.fail(4L, "模型加载失败");

        EvaluationProgress progress = tracker.snapshot(4L).orElseThrow();
        assertThat(progress.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(progress.getErrorMessage()).isEqualTo("模型加载失败");
    }

    @Test
    void unknownRunHasNoSnapshot() {
        assertThat(tracker.snapshot(99L)).isEmpty();
        tracker.start(5L, 1);
        tracker.remove(5L);
        assertThat(tracker.snapshot(5L)).isEmpty();
    }

    @Test
    void concurrentUpdatesAreNotLost() throws InterruptedException {
        int writers = 8;
        int updatesPerWriter = 500;
        tracker.start(6L, writers * updatesPerWriter);
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        for (int w = 0; w < writers; w++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < updatesPerWriter; i++) {
                    tracker.update(6L, "step");
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(tracker.snapshot(6L).orElseThrow().getCompletedSteps()).isEqualTo(writers * updatesPerWriter);
    }
}
