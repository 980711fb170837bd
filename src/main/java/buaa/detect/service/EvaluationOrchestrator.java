package buaa.detect.service;

import buaa.detect.client.Detector;
import buaa.detect.client.GroundTruthStore;
import buaa.detect.client.ImageCatalog;
import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.exception.AbstractException;
import buaa.detect.common.convention.exception.ModelLoadException;
import buaa.detect.common.convention.exception.ServiceException;
import buaa.detect.dto.Detection;
import buaa.detect.dto.DetectionScores;
import buaa.detect.dto.EvaluationImage;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.MatchResult;
import buaa.detect.dto.ModelImageOutcome;
import buaa.detect.model.EvaluationRun;
import buaa.detect.model.ImageEvaluationResult;
import buaa.detect.model.MetricsRowType;
import buaa.detect.model.ModelMetrics;
import buaa.detect.model.RunStatus;
import buaa.detect.model.SpeciesMetrics;
import buaa.detect.repository.ConfusionMatrixEntryRepository;
import buaa.detect.repository.EvaluationRunRepository;
import buaa.detect.repository.ImageEvaluationResultRepository;
import buaa.detect.repository.ModelMetricsRepository;
import buaa.detect.repository.SpeciesMetricsRepository;
import cn.hutool.core.util.StrUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 评测编排器
 *
 * <p>在后台线程中执行一次评测运行：收集图像与真实标注、加载模型、逐图逐模型推理匹配、
 * 汇总模型级/物种级/运行级指标并持久化。同一运行内按固定顺序单线程处理，结果可复现。</p>
 *
 * <p>单张图像上的失败（推理异常、超时、标注格式错误）只跳过该图像；
 * 模型加载失败或其它非图像级异常使整个运行失败。</p>
 */
@Service
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    static final int TOTAL_STEPS = 100;
    private static final int STEP_INITIALIZED = 5;
    private static final int STEP_IMAGES_GATHERED = 10;
    private static final int STEP_MODELS_LOADED = 20;
    private static final int STEP_IMAGES_DONE = 80;
    private static final int STEP_SPECIES_DONE = 90;
    private static final int STEP_RUN_AGGREGATED = 95;

    private final EvaluationRunRepository runRepository;
    private final ModelMetricsRepository modelMetricsRepository;
    private final SpeciesMetricsRepository speciesMetricsRepository;
    private final ImageEvaluationResultRepository imageResultRepository;
    private final ConfusionMatrixEntryRepository confusionRepository;
    private final ImageCatalog imageCatalog;
    private final GroundTruthStore groundTruthStore;
    private final Detector detector;
    private final ModelRegistry modelRegistry;
    private final DetectionNormalizer normalizer;
    private final DetectionMatcher matcher;
    private final MetricsCalculator metricsCalculator;
    private final FoldPartitioner foldPartitioner;
    private final RunAggregator aggregator;
    private final ProgressTracker progressTracker;

    public EvaluationOrchestrator(EvaluationRunRepository runRepository,
                                  ModelMetricsRepository modelMetricsRepository,
                                  SpeciesMetricsRepository speciesMetricsRepository,
                                  ImageEvaluationResultRepository imageResultRepository,
                                  ConfusionMatrixEntryRepository confusionRepository,
                                  ImageCatalog imageCatalog,
                                  GroundTruthStore groundTruthStore,
                                  Detector detector,
                                  ModelRegistry modelRegistry,
                                  DetectionNormalizer normalizer,
                                  DetectionMatcher matcher,
                                  MetricsCalculator metricsCalculator,
                                  FoldPartitioner foldPartitioner,
                                  RunAggregator aggregator,
                                  ProgressTracker progressTracker) {
        this.runRepository = runRepository;
        this.modelMetricsRepository = modelMetricsRepository;
        this.speciesMetricsRepository = speciesMetricsRepository;
        this.imageResultRepository = imageResultRepository;
        this.confusionRepository = confusionRepository;
        this.imageCatalog = imageCatalog;
        this.groundTruthStore = groundTruthStore;
        this.detector = detector;
        this.modelRegistry = modelRegistry;
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.metricsCalculator = metricsCalculator;
        this.foldPartitioner = foldPartitioner;
        this.aggregator = aggregator;
        this.progressTracker = progressTracker;
    }

    /**
     * 异步执行评测运行
     *
     * @param runId 评测运行ID
     * @param token 取消标记
     * @return 运行结束时的状态
     */
    @Async("evaluationExecutor")
    public CompletableFuture<RunStatus> execute(Long runId, CancellationToken token) {
        return CompletableFuture.completedFuture(run(runId, token));
    }

    /**
     * 同步执行评测运行，任何异常都不会使运行停留在 PROCESSING
     */
    public RunStatus run(Long runId, CancellationToken token) {
        Optional<EvaluationRun> runOpt = runRepository.findById(runId);
        if (runOpt.isEmpty()) {
            log.warn("评测运行不存在，跳过执行: {}", runId);
            return RunStatus.FAILED;
        }
        EvaluationRun run = runOpt.get();
        if (run.getStatus() != RunStatus.PENDING) {
            log.warn("评测运行 {} 当前状态为 {}，不能重复执行", runId, run.getStatus());
            return run.getStatus();
        }

        long startNanos = System.nanoTime();
        run = markProcessing(run);
        log.info("评测开始: run={}, models={}, foldCount={}", runId, run.getModelsEvaluated(), run.getFoldCount());

        try {
            evaluate(run, token);
            ensureNotCancelled(token);
            markCompleted(run, startNanos);
            log.info("评测完成: run={}, 图像数={}, 跳过={}", runId,
                run.getTotalImagesEvaluated(), run.getSkippedImages());
            return RunStatus.COMPLETED;
        } catch (OptimisticLockingFailureException e) {
            log.warn("评测运行 {} 已被其他流程终结，放弃写入结果", runId);
            return persistedStatus(runId);
        } catch (Exception e) {
            return markFailed(run, startNanos, e);
        }
    }

    private void evaluate(EvaluationRun run, CancellationToken token) {
        Long runId = run.getId();
        List<String> models = cleanModelNames(run.getModelsEvaluated());
        if (models.isEmpty()) {
            throw new ServiceException(EvalErrorCode.MODELS_EMPTY.message(), EvalErrorCode.EVALUATION_FAILED);
        }
        List<String> speciesFilter = run.getSpeciesFilter();
        progressTracker.advanceTo(runId, STEP_INITIALIZED, "初始化完成");

        List<EvaluationImage> images = imageCatalog.findImages(run.getDateRangeStart(), run.getDateRangeEnd());
        Map<EvaluationImage, List<GroundTruth>> evaluable = loadGroundTruth(run, images, speciesFilter);
        if (evaluable.isEmpty()) {
            throw new ServiceException(
                String.format("没有可评测的图像（候选图像 %d 张，均无可用真实标注）", images.size()),
                EvalErrorCode.NO_EVALUABLE_IMAGES);
        }
        Map<String, Integer> foldOf = assignFolds(run, evaluable);
        progressTracker.advanceTo(runId, STEP_IMAGES_GATHERED,
            String.format("收集图像完成，可评测 %d 张", evaluable.size()));

        List<ModelRegistry.Lease> leases = new ArrayList<>();
        try {
            for (String model : models) {
                leases.add(modelRegistry.acquire(model, run.getDevice()));
            }
            progressTracker.advanceTo(runId, STEP_MODELS_LOADED, "模型加载完成");

            Map<String, List<ModelImageOutcome>> outcomesByModel = new LinkedHashMap<>();
            models.forEach(model -> outcomesByModel.put(model, new ArrayList<>()));
            int groundTruthObjects = 0;
            int processed = 0;
            int attempted = 0;

            for (Map.Entry<EvaluationImage, List<GroundTruth>> entry : evaluable.entrySet()) {
                ensureNotCancelled(token);
                EvaluationImage image = entry.getKey();
                Optional<List<ModelImageOutcome>> outcomes = evaluateImage(
                    run, image, entry.getValue(), foldOf.get(image.getFilename()), leases);
                attempted++;
                if (outcomes.isPresent()) {
                    imageResultRepository.saveAll(toImageRows(runId, outcomes.get()));
                    outcomes.get().forEach(o -> outcomesByModel.get(o.getModelName()).add(o));
                    groundTruthObjects += entry.getValue().size();
                    processed++;
                } else {
                    run.setSkippedImages(run.getSkippedImages() + 1);
                }
                progressTracker.advanceTo(runId,
                    STEP_MODELS_LOADED + (STEP_IMAGES_DONE - STEP_MODELS_LOADED) * attempted / evaluable.size(),
                    String.format("推理与匹配 %d/%d", attempted, evaluable.size()));
            }

            ensureNotCancelled(token);
            List<ModelMetrics> primaryRows = aggregateModels(run, outcomesByModel);
            aggregator.applyRunTotals(run, primaryRows, processed, groundTruthObjects);
            progressTracker.advanceTo(runId, STEP_RUN_AGGREGATED, "运行级汇总完成");
        } finally {
            leases.forEach(ModelRegistry.Lease::close);
        }
    }

    /**
     * 读取并规范化真实标注；没有标注的图像不参与评测，标注损坏的图像计为跳过
     */
    private Map<EvaluationImage, List<GroundTruth>> loadGroundTruth(EvaluationRun run,
                                                                    List<EvaluationImage> images,
                                                                    List<String> speciesFilter) {
        Map<EvaluationImage, List<GroundTruth>> evaluable = new LinkedHashMap<>();
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        for (EvaluationImage image : images) {
            if (!seen.add(image.getFilename())) {
                continue;
            }
            try {
                List<GroundTruth> groundTruths = normalizer.normalizeGroundTruth(
                    groundTruthStore.load(image), image, speciesFilter);
                if (groundTruths.isEmpty()) {
                    log.debug("图像无真实标注，不参与评测: {}", image.getFilename());
                    continue;
                }
                evaluable.put(image, groundTruths);
            } catch (RuntimeException e) {
                log.warn("读取真实标注失败，跳过图像 {}", image.getFilename(), e);
                run.setSkippedImages(run.getSkippedImages() + 1);
            }
        }
        return evaluable;
    }

    private Map<String, Integer> assignFolds(EvaluationRun run, Map<EvaluationImage, List<GroundTruth>> evaluable) {
        Map<String, Integer> foldOf = new LinkedHashMap<>();
        if (!run.isKFold()) {
            return foldOf;
        }
        for (EvaluationImage image : evaluable.keySet()) {
            foldOf.put(image.getFilename(), foldPartitioner.foldIndex(image.getFilename(), run.getFoldCount()));
        }
        return foldOf;
    }

    /**
     * 对单张图像依次运行全部模型；任一模型失败则整张图像不计入任何汇总
     */
    private Optional<List<ModelImageOutcome>> evaluateImage(EvaluationRun run,
                                                            EvaluationImage image,
                                                            List<GroundTruth> groundTruths,
                                                            Integer foldIndex,
                                                            List<ModelRegistry.Lease> leases) {
        List<ModelImageOutcome> outcomes = new ArrayList<>(leases.size());
        for (ModelRegistry.Lease lease : leases) {
            String modelName = lease.model().getModelId();
            try {
                long begin = System.nanoTime();
                List<Detection> raw = detector.detect(lease.model(), image, run.getConfidenceThreshold());
                double inferenceMs = (System.nanoTime() - begin) / 1_000_000.0;

                List<Detection> predictions = normalizer.normalizeDetections(raw, image, run.getSpeciesFilter());
                MatchResult matchResult = matcher.match(predictions, groundTruths, run.getIouThreshold());
                DetectionScores scores = metricsCalculator.scores(matchResult);
                outcomes.add(new ModelImageOutcome(modelName, image.getFilename(), foldIndex,
                    predictions, groundTruths, matchResult, scores, inferenceMs));
            } catch (ModelLoadException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("图像评测失败，已跳过: run={}, image={}, model={}",
                    run.getId(), image.getFilename(), modelName, e);
                return Optional.empty();
            }
        }
        return Optional.of(outcomes);
    }

    private List<ImageEvaluationResult> toImageRows(Long runId, List<ModelImageOutcome> outcomes) {
        List<ImageEvaluationResult> rows = new ArrayList<>(outcomes.size());
        for (ModelImageOutcome outcome : outcomes) {
            rows.add(aggregator.imageRow(runId, outcome));
        }
        return rows;
    }

    /**
     * 模型级与物种级汇总并持久化
     *
     * @return 各模型的主指标行（普通评测为 OVERALL，K折评测为 KFOLD_AGGREGATE）
     */
    private List<ModelMetrics> aggregateModels(EvaluationRun run, Map<String, List<ModelImageOutcome>> outcomesByModel) {
        Long runId = run.getId();
        List<String> speciesFilter = run.getSpeciesFilter();
        List<ModelMetrics> primaryRows = new ArrayList<>();
        Map<ModelMetrics, List<ModelImageOutcome>> speciesScopes = new LinkedHashMap<>();

        for (Map.Entry<String, List<ModelImageOutcome>> entry : outcomesByModel.entrySet()) {
            String model = entry.getKey();
            List<ModelImageOutcome> outcomes = entry.getValue();

            if (run.isKFold()) {
                Map<Integer, List<ModelImageOutcome>> folds =
                    foldPartitioner.partition(outcomes, ModelImageOutcome::getFilename, run.getFoldCount());
                List<ModelMetrics> foldRows = new ArrayList<>();
                for (Map.Entry<Integer, List<ModelImageOutcome>> fold : folds.entrySet()) {
                    ModelMetrics foldRow = modelMetricsRepository.save(aggregator.modelRow(
                        runId, model, MetricsRowType.FOLD, fold.getKey(), fold.getValue(), speciesFilter));
                    foldRows.add(foldRow);
                    speciesScopes.put(foldRow, fold.getValue());
                }
                ModelMetrics aggregate = modelMetricsRepository.save(
                    aggregator.foldAggregateRow(runId, model, foldRows));
                speciesScopes.put(aggregate, outcomes);
                primaryRows.add(aggregate);
            } else {
                ModelMetrics overall = modelMetricsRepository.save(aggregator.modelRow(
                    runId, model, MetricsRowType.OVERALL, null, outcomes, speciesFilter));
                speciesScopes.put(overall, outcomes);
                primaryRows.add(overall);
            }
            confusionRepository.saveAll(
                aggregator.confusionEntries(runId, model, outcomes, run.getIouThreshold()));
        }
        progressTracker.advanceTo(runId, STEP_IMAGES_DONE, "模型级汇总完成");

        for (Map.Entry<ModelMetrics, List<ModelImageOutcome>> scope : speciesScopes.entrySet()) {
            List<SpeciesMetrics> rows = aggregator.speciesRows(
                runId, scope.getKey().getId(), scope.getValue(), speciesFilter);
            speciesMetricsRepository.saveAll(rows);
        }
        progressTracker.advanceTo(runId, STEP_SPECIES_DONE, "物种级汇总完成");
        return primaryRows;
    }

    /**
     * 清理模型列表：去除空白项与重复项，保持原有顺序
     */
    public static List<String> cleanModelNames(List<String> models) {
        LinkedHashSet<String> cleaned = new LinkedHashSet<>();
        if (models != null) {
            for (String model : models) {
                if (StrUtil.isNotBlank(model)) {
                    cleaned.add(model.trim());
                }
            }
        }
        return new ArrayList<>(cleaned);
    }

    private static void ensureNotCancelled(CancellationToken token) {
        if (token != null && token.isCancelled()) {
            throw new ServiceException(EvalErrorCode.EVALUATION_CANCELLED);
        }
    }

    private EvaluationRun markProcessing(EvaluationRun run) {
        progressTracker.start(run.getId(), TOTAL_STEPS);
        run.transitionTo(RunStatus.PROCESSING);
        run.setStartedAt(LocalDateTime.now());
        run.setErrorMessage(null);
        run.setSkippedImages(0);
        return runRepository.save(run);
    }

    /**
     * 写入完成状态；运行已被取消或回收时版本号不匹配，保存抛出
     * {@link OptimisticLockingFailureException}
     */
    private void markCompleted(EvaluationRun run, long startNanos) {
        run.transitionTo(RunStatus.COMPLETED);
        run.setFinishedAt(LocalDateTime.now());
        run.setProcessingDurationMs(Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
        runRepository.save(run);
        progressTracker.complete(run.getId());
    }

    private RunStatus markFailed(EvaluationRun run, long startNanos, Exception error) {
        String message = error instanceof AbstractException
            ? ((AbstractException) error).getErrorMessage()
            : "评测执行异常: " + error.getMessage();
        log.error("评测失败: run={}, {}", run.getId(), message, error);

        run.setErrorMessage(message);
        run.setFinishedAt(LocalDateTime.now());
        run.setProcessingDurationMs(Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
        if (run.getStatus() == RunStatus.PROCESSING) {
            run.transitionTo(RunStatus.FAILED);
        } else {
            // 完成状态写库失败时内存中已是 COMPLETED
            run.setStatus(RunStatus.FAILED);
        }
        try {
            runRepository.save(run);
        } catch (OptimisticLockingFailureException e) {
            log.warn("评测运行 {} 已被其他流程终结，保留已有状态", run.getId());
            return persistedStatus(run.getId());
        } catch (RuntimeException e) {
            log.error("评测失败状态写入失败: run={}", run.getId(), e);
        }
        progressTracker.fail(run.getId(), message);
        return RunStatus.FAILED;
    }

    private RunStatus persistedStatus(Long runId) {
        return runRepository.findById(runId)
            .map(EvaluationRun::getStatus)
            .orElse(RunStatus.FAILED);
    }
}
