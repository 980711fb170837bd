package buaa.detect.service;

import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.exception.ClientException;
import buaa.detect.config.EvaluationConfiguration;
import buaa.detect.dto.EvaluationProgress;
import buaa.detect.dto.EvaluationRunRequest;
import buaa.detect.dto.ModelComparisonResponse;
import buaa.detect.model.EvaluationRun;
import buaa.detect.model.MetricsRowType;
import buaa.detect.model.ModelMetrics;
import buaa.detect.model.RunStatus;
import buaa.detect.repository.ConfusionMatrixEntryRepository;
import buaa.detect.repository.EvaluationRunRepository;
import buaa.detect.repository.ImageEvaluationResultRepository;
import buaa.detect.repository.ModelMetricsRepository;
import buaa.detect.repository.SpeciesMetricsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvaluationServiceTest {

    private EvaluationRunRepository runRepository;
    private ModelMetricsRepository modelMetricsRepository;
    private SpeciesMetricsRepository speciesMetricsRepository;
    private ImageEvaluationResultRepository imageResultRepository;
    private ConfusionMatrixEntryRepository confusionRepository;
    private EvaluationOrchestrator orchestrator;
    private ProgressTracker progressTracker;
    private EvaluationService service;

    @BeforeEach
    void setUp() {
        runRepository = mock(EvaluationRunRepository.class);
        modelMetricsRepository = mock(ModelMetricsRepository.class);
        speciesMetricsRepository = mock(SpeciesMetricsRepository.class);
        imageResultRepository = mock(ImageEvaluationResultRepository.class);
        confusionRepository = mock(ConfusionMatrixEntryRepository.class);
        orchestrator = mock(EvaluationOrchestrator.class);
        progressTracker = new ProgressTracker();
        when(runRepository.save(any(EvaluationRun.class))).thenAnswer(inv -> {
            EvaluationRun run = inv.getArgument(0);
            if (run.getId() == null) {
                run.setId(1L);
            }
            return run;
        });
        service = newService(progressTracker);
    }

    private EvaluationService newService(ProgressTracker tracker) {
        return new EvaluationService(runRepository, modelMetricsRepository, speciesMetricsRepository,
            imageResultRepository, confusionRepository, orchestrator, tracker,
            new StatisticalAnalyzer(), new DetectionNormalizer(), new EvaluationConfiguration());
    }

    // ==================== 参数校验 ====================

    @Test
    void confidenceThresholdAboveOneIsRejectedBeforePersistence() {
        EvaluationRunRequest request = new EvaluationRunRequest();
        request.setConfidenceThreshold(1.1);

        assertThatThrownBy(() -> service.createRun(request))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(EvalErrorCode.CONFIDENCE_THRESHOLD_INVALID.code());
        verify(runRepository, never()).save(any());
    }

    @Test
    void negativeIouThresholdIsRejectedBeforePersistence() {
        EvaluationRunRequest request = new EvaluationRunRequest();
        request.setIouThreshold(-0.1);

        assertThatThrownBy(() -> service.createRun(request))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(EvalErrorCode.IOU_THRESHOLD_INVALID.code());
        verify(runRepository, never()).save(any());
    }

    @Test
    void invalidFoldCountDateRangeAndModelsAreRejected() {
        EvaluationRunRequest folds = new EvaluationRunRequest();
        folds.setFoldCount(0);
        assertThatThrownBy(() -> service.createRun(folds))
            .extracting("errorCode").isEqualTo(EvalErrorCode.FOLD_COUNT_INVALID.code());

        EvaluationRunRequest dates = new EvaluationRunRequest();
        dates.setDateRangeStart(LocalDateTime.of(2024, 6, 1, 0, 0));
        dates.setDateRangeEnd(LocalDateTime.of(2024, 5, 1, 0, 0));
        assertThatThrownBy(() -> service.createRun(dates))
            .extracting("errorCode").isEqualTo(EvalErrorCode.DATE_RANGE_INVALID.code());

        EvaluationRunRequest blanks = new EvaluationRunRequest();
        blanks.setModels(Arrays.asList(" ", ""));
        assertThatThrownBy(() -> service.createRun(blanks))
            .extracting("errorCode").isEqualTo(EvalErrorCode.MODELS_EMPTY.code());

        verify(runRepository, never()).save(any());
    }

    @Test
    void foldCountAboveConfiguredLimitIsRejected() {
        EvaluationRunRequest request = new EvaluationRunRequest();
        request.setFoldCount(1_000_000);

        assertThatThrownBy(() -> service.createRun(request))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(EvalErrorCode.FOLD_COUNT_INVALID.code());
        verify(runRepository, never()).save(any());
    }

    @Test
    void defaultsAreAppliedAndInputsCleaned() {
        EvaluationRunRequest request = new EvaluationRunRequest();
        request.setModels(List.of("yolov8l", " yolov5s", "yolov8l"));
        request.setSpeciesFilter(List.of("Chinese Egret", "chinese_egret"));

        EvaluationRun run = service.createRun(request);

        assertThat(run.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(run.getIouThreshold()).isEqualTo(0.5);
        assertThat(run.getConfidenceThreshold()).isEqualTo(0.25);
        assertThat(run.getModelsEvaluated()).containsExactly("yolov8l", "yolov5s");
        assertThat(run.getSpeciesFilter()).containsExactly("chinese_egret");
        assertThat(run.getDevice()).isEqualTo("cpu");
        assertThat(run.getName()).isNotBlank();
    }

    @Test
    void emptyModelListFallsBackToConfiguredModels() {
        EvaluationRun run = service.createRun(new EvaluationRunRequest());

        assertThat(run.getModelsEvaluated()).containsExactly("yolov5s", "yolov8l", "yolov9c");
    }

    // ==================== 启动与取消 ====================

    @Test
    void secondStartWhileActiveIsRejected() {
        EvaluationRun run = existingRun(1L, RunStatus.PENDING, null);
        when(orchestrator.execute(eq(1L), any())).thenReturn(new CompletableFuture<>());

        service.startEvaluation(1L);

        assertThatThrownBy(() -> service.startEvaluation(1L))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(EvalErrorCode.RUN_ALREADY_STARTED.code());
        verify(orchestrator, times(1)).execute(eq(1L), any());
        assertThat(service.isActive(run.getId())).isTrue();
    }

    @Test
    void terminalRunCannotBeStarted() {
        existingRun(2L, RunStatus.COMPLETED, null);

        assertThatThrownBy(() -> service.startEvaluation(2L))
            .extracting("errorCode").isEqualTo(EvalErrorCode.RUN_ALREADY_STARTED.code());
        verify(orchestrator, never()).execute(anyLong(), any());
    }

    @Test
    void finishedExecutionIsNoLongerActive() {
        existingRun(3L, RunStatus.PENDING, null);
        CompletableFuture<RunStatus> future = new CompletableFuture<>();
        when(orchestrator.execute(eq(3L), any())).thenReturn(future);

        CompletableFuture<RunStatus> started = service.startEvaluation(3L);
        future.complete(RunStatus.COMPLETED);

        assertThat(started.join()).isEqualTo(RunStatus.COMPLETED);
        assertThat(service.isActive(3L)).isFalse();
    }

    @Test
    void cancelFlipsTokenOfActiveRun() {
        existingRun(4L, RunStatus.PENDING, null);
        when(orchestrator.execute(eq(4L), any())).thenReturn(new CompletableFuture<>());
        service.startEvaluation(4L);

        service.cancelEvaluation(4L);

        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        verify(orchestrator).execute(eq(4L), token.capture());
        assertThat(token.getValue().isCancelled()).isTrue();
    }

    @Test
    void cancelPendingRunMarksItFailed() {
        EvaluationRun run = existingRun(5L, RunStatus.PENDING, null);

        service.cancelEvaluation(5L);

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorMessage()).isEqualTo(EvalErrorCode.EVALUATION_CANCELLED.message());
    }

    @Test
    void unknownRunIsReportedAsNotFound() {
        when(runRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getRun(404L))
            .extracting("errorCode").isEqualTo(EvalErrorCode.RUN_NOT_FOUND.code());
    }

    // ==================== 进度与回收 ====================

    @Test
    void progressFallsBackToPersistedStatus() {
        EvaluationRun run = existingRun(6L, RunStatus.FAILED, null);
        run.setErrorMessage("模型 x 加载失败");

        EvaluationProgress progress = service.getProgress(6L);

        assertThat(progress.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(progress.getErrorMessage()).isEqualTo("模型 x 加载失败");
    }

    @Test
    void staleProcessingRunIsReaped() {
        ProgressTracker oldTracker = new ProgressTracker(
            Clock.fixed(Instant.now().minusSeconds(3600), ZoneOffset.UTC));
        EvaluationService reaper = newService(oldTracker);
        EvaluationRun stale = existingRun(7L, RunStatus.PROCESSING, null);
        oldTracker.start(7L, 100);
        when(runRepository.findByStatus(RunStatus.PROCESSING)).thenReturn(List.of(stale));

        int reaped = reaper.reapStaleRuns();

        assertThat(reaped).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(stale.getErrorMessage()).isEqualTo(EvalErrorCode.EVALUATION_STALLED.message());
    }

    @Test
    void processingRunWithFreshProgressIsKept() {
        EvaluationRun fresh = existingRun(8L, RunStatus.PROCESSING, null);
        progressTracker.start(8L, 100);
        when(runRepository.findByStatus(RunStatus.PROCESSING)).thenReturn(List.of(fresh));

        assertThat(service.reapStaleRuns()).isZero();
        assertThat(fresh.getStatus()).isEqualTo(RunStatus.PROCESSING);
    }

    @Test
    void processingRunUnknownToThisProcessIsReaped() {
        EvaluationRun orphan = existingRun(9L, RunStatus.PROCESSING, null);
        when(runRepository.findByStatus(RunStatus.PROCESSING)).thenReturn(List.of(orphan));

        assertThat(service.reapStaleRuns()).isEqualTo(1);
        assertThat(orphan.getStatus()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void reaperKeepsRunFinishedByWorkerInTheMeantime() {
        EvaluationRun copy = existingRun(15L, RunStatus.PROCESSING, null);
        when(runRepository.findByStatus(RunStatus.PROCESSING)).thenReturn(List.of(copy));
        when(runRepository.save(copy)).thenThrow(new ObjectOptimisticLockingFailureException(EvaluationRun.class, 15L));

        assertThat(service.reapStaleRuns()).isZero();
        assertThat(progressTracker.snapshot(15L)).isEmpty();
    }

    @Test
    void cancelOfRunFinishedInTheMeantimeIsRejected() {
        EvaluationRun copy = existingRun(16L, RunStatus.PENDING, null);
        when(runRepository.save(copy)).thenThrow(new ObjectOptimisticLockingFailureException(EvaluationRun.class, 16L));

        assertThatThrownBy(() -> service.cancelEvaluation(16L))
            .isInstanceOf(ClientException.class)
            .extracting("errorCode").isEqualTo(EvalErrorCode.RUN_ALREADY_STARTED.code());
        assertThat(progressTracker.snapshot(16L)).isEmpty();
    }

    // ==================== 删除与比较 ====================

    @Test
    void processingRunCannotBeDeleted() {
        existingRun(10L, RunStatus.PROCESSING, null);

        assertThatThrownBy(() -> service.deleteRun(10L))
            .extracting("errorCode").isEqualTo(EvalErrorCode.RUN_IN_PROGRESS.code());
        verify(modelMetricsRepository, never()).deleteByRunId(any());
    }

    @Test
    void deleteRemovesAllChildRows() {
        EvaluationRun run = existingRun(11L, RunStatus.COMPLETED, null);

        service.deleteRun(11L);

        verify(speciesMetricsRepository).deleteByRunId(11L);
        verify(modelMetricsRepository).deleteByRunId(11L);
        verify(imageResultRepository).deleteByRunId(11L);
        verify(confusionRepository).deleteByRunId(11L);
        verify(runRepository).delete(run);
    }

    @Test
    void comparisonOfWellSeparatedModelsIsSignificant() {
        existingRun(12L, RunStatus.COMPLETED, 3);
        List<ModelMetrics> folds = new ArrayList<>();
        double[] first = {0.80, 0.82, 0.79};
        double[] second = {0.60, 0.58, 0.62};
        for (int i = 0; i < 3; i++) {
            folds.add(foldRow("yolov9c", i, first[i]));
            folds.add(foldRow("yolov5s", i, second[i]));
        }
        when(modelMetricsRepository.findByRunIdAndRowTypeOrderByIdAsc(12L, MetricsRowType.FOLD)).thenReturn(folds);

        ModelComparisonResponse response = service.compareModels(12L, "f1", 0.05);

        assertThat(response.getModels()).extracting(ModelComparisonResponse.ModelSample::getModelName)
            .containsExactly("yolov9c", "yolov5s");
        assertThat(response.getModels().get(0).getSummary().getCiLower()).isNotNull();
        assertThat(response.getComparisons()).hasSize(1);
        assertThat(response.getComparisons().get(0).getTest().getTwoSidedPValue()).isLessThan(0.05);
        assertThat(response.getComparisons().get(0).getTest().isSignificant()).isTrue();
    }

    @Test
    void foldsWithoutImagesAreLeftOutOfComparisonSamples() {
        existingRun(17L, RunStatus.COMPLETED, 4);
        List<ModelMetrics> folds = new ArrayList<>();
        folds.add(foldRow("yolov8l", 0, 0.9));
        folds.add(foldRow("yolov8l", 1, 0.7));
        ModelMetrics empty = foldRow("yolov8l", 2, 0.0);
        empty.setF1Score(null);
        folds.add(empty);
        when(modelMetricsRepository.findByRunIdAndRowTypeOrderByIdAsc(17L, MetricsRowType.FOLD)).thenReturn(folds);

        ModelComparisonResponse response = service.compareModels(17L, "F1", 0.05);

        assertThat(response.getModels()).hasSize(1);
        assertThat(response.getModels().get(0).getFoldValues()).containsExactly(0.9, 0.7);
    }

    @Test
    void comparisonRequiresKFoldRunAndKnownMetric() {
        existingRun(13L, RunStatus.COMPLETED, null);
        existingRun(14L, RunStatus.COMPLETED, 5);

        assertThatThrownBy(() -> service.compareModels(13L, "F1", 0.05))
            .extracting("errorCode").isEqualTo(EvalErrorCode.RUN_NOT_KFOLD.code());
        assertThatThrownBy(() -> service.compareModels(14L, "accuracy", 0.05))
            .extracting("errorCode").isEqualTo(EvalErrorCode.METRIC_NOT_SUPPORTED.code());
        assertThatThrownBy(() -> service.compareModels(14L, "F1", 1.5))
            .extracting("errorCode").isEqualTo(EvalErrorCode.ALPHA_INVALID.code());
    }

    private EvaluationRun existingRun(Long id, RunStatus status, Integer foldCount) {
        EvaluationRun run = new EvaluationRun();
        run.setId(id);
        run.setName("run-" + id);
        run.setIouThreshold(0.5);
        run.setConfidenceThreshold(0.25);
        run.setModelsEvaluated(List.of("yolov8l"));
        run.setFoldCount(foldCount);
        run.setStatus(status);
        when(runRepository.findById(id)).thenReturn(Optional.of(run));
        return run;
    }

    private static ModelMetrics foldRow(String model, int fold, double f1) {
        ModelMetrics row = new ModelMetrics();
        row.setModelName(model);
        row.setRowType(MetricsRowType.FOLD);
        row.setFoldIndex(fold);
        row.setF1Score(f1);
        return row;
    }
}
