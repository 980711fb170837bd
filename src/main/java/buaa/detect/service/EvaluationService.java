package buaa.detect.service;

import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.exception.ClientException;
import buaa.detect.config.EvaluationConfiguration;
import buaa.detect.dto.ComparisonMetric;
import buaa.detect.dto.EvaluationProgress;
import buaa.detect.dto.EvaluationRunRequest;
import buaa.detect.dto.ModelComparisonResponse;
import buaa.detect.dto.ModelMetricsResponse;
import buaa.detect.model.ConfusionMatrixEntry;
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
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 检测评测服务
 *
 * <p>负责参数校验与运行创建、启动与取消、进度与结果查询、K折模型比较，
 * 以及定时回收长时间没有进度的运行。</p>
 */
@Slf4j
@Service
public class EvaluationService {

    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final EvaluationRunRepository runRepository;
    private final ModelMetricsRepository modelMetricsRepository;
    private final SpeciesMetricsRepository speciesMetricsRepository;
    private final ImageEvaluationResultRepository imageResultRepository;
    private final ConfusionMatrixEntryRepository confusionRepository;
    private final EvaluationOrchestrator orchestrator;
    private final ProgressTracker progressTracker;
    private final StatisticalAnalyzer statisticalAnalyzer;
    private final DetectionNormalizer normalizer;
    private final EvaluationConfiguration configuration;

    /** 正在执行的运行及其取消标记 */
    private final Map<Long, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    public EvaluationService(EvaluationRunRepository runRepository,
                             ModelMetricsRepository modelMetricsRepository,
                             SpeciesMetricsRepository speciesMetricsRepository,
                             ImageEvaluationResultRepository imageResultRepository,
                             ConfusionMatrixEntryRepository confusionRepository,
                             EvaluationOrchestrator orchestrator,
                             ProgressTracker progressTracker,
                             StatisticalAnalyzer statisticalAnalyzer,
                             DetectionNormalizer normalizer,
                             EvaluationConfiguration configuration) {
        this.runRepository = runRepository;
        this.modelMetricsRepository = modelMetricsRepository;
        this.speciesMetricsRepository = speciesMetricsRepository;
        this.imageResultRepository = imageResultRepository;
        this.confusionRepository = confusionRepository;
        this.orchestrator = orchestrator;
        this.progressTracker = progressTracker;
        this.statisticalAnalyzer = statisticalAnalyzer;
        this.normalizer = normalizer;
        this.configuration = configuration;
    }

    // ==================== 创建与执行 ====================

    /**
     * 校验参数并创建 PENDING 状态的评测运行，校验失败时不写入任何数据
     *
     * @throws ClientException 参数不合法
     */
    public EvaluationRun createRun(EvaluationRunRequest request) {
        EvaluationConfiguration.Defaults defaults = configuration.getDefaults();

        double iouThreshold = Optional.ofNullable(request.getIouThreshold()).orElse(defaults.getIouThreshold());
        if (!isUnitInterval(iouThreshold)) {
            throw new ClientException("IoU阈值必须在0-1之间: " + iouThreshold, EvalErrorCode.IOU_THRESHOLD_INVALID);
        }
        double confidenceThreshold = Optional.ofNullable(request.getConfidenceThreshold())
            .orElse(defaults.getConfidenceThreshold());
        if (!isUnitInterval(confidenceThreshold)) {
            throw new ClientException("置信度阈值必须在0-1之间: " + confidenceThreshold,
                EvalErrorCode.CONFIDENCE_THRESHOLD_INVALID);
        }
        if (request.getFoldCount() != null
            && (request.getFoldCount() < 1 || request.getFoldCount() > configuration.getMaxFoldCount())) {
            throw new ClientException(String.format("折数必须在1-%d之间: %d",
                configuration.getMaxFoldCount(), request.getFoldCount()), EvalErrorCode.FOLD_COUNT_INVALID);
        }
        if (request.getDateRangeStart() != null && request.getDateRangeEnd() != null
            && request.getDateRangeStart().isAfter(request.getDateRangeEnd())) {
            throw new ClientException(EvalErrorCode.DATE_RANGE_INVALID);
        }

        List<String> requested = request.getModels();
        List<String> models = EvaluationOrchestrator.cleanModelNames(
            requested == null || requested.isEmpty() ? defaults.getModels() : requested);
        if (models.isEmpty()) {
            throw new ClientException(EvalErrorCode.MODELS_EMPTY);
        }

        EvaluationRun run = new EvaluationRun();
        run.setName(StrUtil.isBlank(request.getName())
            ? "检测评测-" + LocalDateTime.now().format(NAME_FORMAT)
            : request.getName().trim());
        run.setDescription(request.getDescription());
        run.setIouThreshold(iouThreshold);
        run.setConfidenceThreshold(confidenceThreshold);
        run.setModelsEvaluated(models);
        run.setSpeciesFilter(new ArrayList<>(new LinkedHashSet<>(
            normalizeSpecies(request.getSpeciesFilter()))));
        run.setDateRangeStart(request.getDateRangeStart());
        run.setDateRangeEnd(request.getDateRangeEnd());
        run.setFoldCount(request.getFoldCount());
        run.setDevice(StrUtil.isBlank(request.getDevice()) ? defaults.getDevice() : request.getDevice().trim());

        EvaluationRun saved = runRepository.save(run);
        log.info("评测运行已创建: id={}, models={}, foldCount={}", saved.getId(), models, saved.getFoldCount());
        return saved;
    }

    /**
     * 启动评测，立即返回；同一运行同时最多只有一次执行
     *
     * @return 运行结束时完成的 future
     * @throws ClientException 运行不存在，或已启动/已结束
     */
    public CompletableFuture<RunStatus> startEvaluation(Long runId) {
        EvaluationRun run = requireRun(runId);
        CancellationToken token = new CancellationToken();
        synchronized (activeRuns) {
            if (run.getStatus() != RunStatus.PENDING || activeRuns.containsKey(runId)) {
                throw new ClientException(
                    String.format("评测运行 %d 已启动或已结束（当前状态 %s）", runId, run.getStatus()),
                    EvalErrorCode.RUN_ALREADY_STARTED);
            }
            activeRuns.put(runId, token);
        }

        log.info("提交评测任务: {}", runId);
        CompletableFuture<RunStatus> future;
        try {
            future = orchestrator.execute(runId, token);
        } catch (RuntimeException e) {
            activeRuns.remove(runId);
            throw e;
        }
        return future.whenComplete((status, error) -> {
            activeRuns.remove(runId, token);
            if (error != null) {
                log.error("评测任务异常结束: {}", runId, error);
            }
        });
    }

    /**
     * 取消评测。执行中的运行在下一张图像开始前停止；尚未启动的运行直接置为失败
     */
    public void cancelEvaluation(Long runId) {
        EvaluationRun run = requireRun(runId);
        CancellationToken token = activeRuns.get(runId);
        if (token != null) {
            token.cancel();
            log.info("已请求取消评测: {}", runId);
            return;
        }
        if (run.isTerminal()) {
            throw new ClientException(
                String.format("评测运行 %d 已结束（%s），无法取消", runId, run.getStatus()),
                EvalErrorCode.RUN_ALREADY_STARTED);
        }
        if (!markFailed(run, EvalErrorCode.EVALUATION_CANCELLED.message())) {
            throw new ClientException(
                String.format("评测运行 %d 已结束，无法取消", runId), EvalErrorCode.RUN_ALREADY_STARTED);
        }
    }

    public boolean isActive(Long runId) {
        return activeRuns.containsKey(runId);
    }

    // ==================== 查询 ====================

    public EvaluationRun getRun(Long runId) {
        return requireRun(runId);
    }

    public List<EvaluationRun> listRuns() {
        return runRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * 进度快照；当前进程没有进度记录时（如重启后）按持久化状态推断
     */
    public EvaluationProgress getProgress(Long runId) {
        Optional<EvaluationProgress> snapshot = progressTracker.snapshot(runId);
        if (snapshot.isPresent()) {
            return snapshot.get();
        }
        EvaluationRun run = requireRun(runId);
        switch (run.getStatus()) {
            case COMPLETED:
                return new EvaluationProgress(runId, RunStatus.COMPLETED, "评测完成",
                    EvaluationOrchestrator.TOTAL_STEPS, EvaluationOrchestrator.TOTAL_STEPS, null, Instant.now());
            case FAILED:
                return new EvaluationProgress(runId, RunStatus.FAILED, "评测失败",
                    0, EvaluationOrchestrator.TOTAL_STEPS, run.getErrorMessage(), Instant.now());
            case PROCESSING:
                return new EvaluationProgress(runId, RunStatus.PROCESSING, "进度未知",
                    0, EvaluationOrchestrator.TOTAL_STEPS, null, Instant.now());
            default:
                return EvaluationProgress.pending(runId);
        }
    }

    public List<ModelMetricsResponse> getModelMetrics(Long runId) {
        requireRun(runId);
        List<ModelMetrics> rows = modelMetricsRepository.findByRunIdOrderByIdAsc(runId);
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<Long, List<SpeciesMetrics>> speciesByRow = speciesMetricsRepository
            .findByModelMetricsIdInOrderByClassNameAsc(
                rows.stream().map(ModelMetrics::getId).collect(Collectors.toList()))
            .stream()
            .collect(Collectors.groupingBy(SpeciesMetrics::getModelMetricsId));

        List<ModelMetricsResponse> responses = new ArrayList<>(rows.size());
        for (ModelMetrics row : rows) {
            responses.add(new ModelMetricsResponse(row, speciesByRow.getOrDefault(row.getId(), List.of())));
        }
        return responses;
    }

    public List<ImageEvaluationResult> getImageResults(Long runId, String modelName) {
        requireRun(runId);
        if (StrUtil.isBlank(modelName)) {
            return imageResultRepository.findByRunIdOrderByIdAsc(runId);
        }
        return imageResultRepository.findByRunIdAndModelNameOrderByIdAsc(runId, modelName.trim());
    }

    public List<ConfusionMatrixEntry> getConfusionMatrix(Long runId, String modelName) {
        requireRun(runId);
        if (StrUtil.isBlank(modelName)) {
            return confusionRepository.findByRunIdOrderByCountDesc(runId);
        }
        return confusionRepository.findByRunIdAndModelNameOrderByCountDesc(runId, modelName.trim());
    }

    /**
     * K折评测的模型间比较：以各折指标为样本，给出每个模型的置信区间与两两 t 检验
     *
     * @param metricName 指标名（PRECISION / RECALL / F1 / MAP_50），为空时为 F1
     * @param alpha 显著性水平，为空时为 0.05
     */
    public ModelComparisonResponse compareModels(Long runId, String metricName, Double alpha) {
        EvaluationRun run = requireRun(runId);
        if (!run.isKFold()) {
            throw new ClientException(String.format("评测运行 %d 不是K折评测", runId), EvalErrorCode.RUN_NOT_KFOLD);
        }
        ComparisonMetric metric = parseMetric(metricName);
        double significance = alpha == null ? 0.05 : alpha;
        if (!(significance > 0 && significance < 1)) {
            throw new ClientException("显著性水平必须在0-1之间: " + significance, EvalErrorCode.ALPHA_INVALID);
        }

        Function<ModelMetrics, Double> field = metricField(metric);
        Map<String, List<Double>> samples = new LinkedHashMap<>();
        for (ModelMetrics row : modelMetricsRepository.findByRunIdAndRowTypeOrderByIdAsc(runId, MetricsRowType.FOLD)) {
            List<Double> values = samples.computeIfAbsent(row.getModelName(), name -> new ArrayList<>());
            Double value = field.apply(row);
            if (value != null) {
                values.add(value);
            }
        }

        ModelComparisonResponse response = new ModelComparisonResponse();
        response.setRunId(runId);
        response.setMetric(metric);
        response.setAlpha(significance);
        List<String> names = new ArrayList<>(samples.keySet());
        for (String name : names) {
            List<Double> values = samples.get(name);
            response.getModels().add(new ModelComparisonResponse.ModelSample(
                name, values, statisticalAnalyzer.summarize(toArray(values), significance)));
        }
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                response.getComparisons().add(new ModelComparisonResponse.PairwiseComparison(
                    names.get(i), names.get(j),
                    statisticalAnalyzer.compare(
                        toArray(samples.get(names.get(i))), toArray(samples.get(names.get(j))), significance)));
            }
        }
        return response;
    }

    // ==================== 删除与回收 ====================

    /**
     * 删除评测运行及其全部结果，执行中的运行不可删除
     */
    @Transactional
    public void deleteRun(Long runId) {
        EvaluationRun run = requireRun(runId);
        if (run.getStatus() == RunStatus.PROCESSING || activeRuns.containsKey(runId)) {
            throw new ClientException(String.format("评测运行 %d 正在执行，不能删除", runId), EvalErrorCode.RUN_IN_PROGRESS);
        }
        speciesMetricsRepository.deleteByRunId(runId);
        modelMetricsRepository.deleteByRunId(runId);
        imageResultRepository.deleteByRunId(runId);
        confusionRepository.deleteByRunId(runId);
        runRepository.delete(run);
        progressTracker.remove(runId);
        log.info("评测运行已删除: {}", runId);
    }

    /**
     * 将长时间没有进度（或当前进程没有进度记录）的 PROCESSING 运行置为失败
     *
     * @return 回收的运行数
     */
    @Scheduled(fixedDelayString = "${evaluation.stale-check-interval-ms:60000}")
    public int reapStaleRuns() {
        Instant deadline = Instant.now().minus(configuration.getStaleTimeout());
        int reaped = 0;
        for (EvaluationRun run : runRepository.findByStatus(RunStatus.PROCESSING)) {
            Optional<EvaluationProgress> progress = progressTracker.snapshot(run.getId());
            boolean stale = progress.isEmpty() || progress.get().getUpdatedAt().isBefore(deadline);
            if (!stale) {
                continue;
            }
            CancellationToken token = activeRuns.remove(run.getId());
            if (token != null) {
                token.cancel();
            }
            Duration idle = progress.map(p -> Duration.between(p.getUpdatedAt(), Instant.now())).orElse(null);
            log.warn("评测运行 {} 超时无进度，标记为失败（空闲 {}）", run.getId(), idle == null ? "未知" : idle);
            if (markFailed(run, EvalErrorCode.EVALUATION_STALLED.message())) {
                reaped++;
            }
        }
        return reaped;
    }

    // ==================== 内部方法 ====================

    private EvaluationRun requireRun(Long runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new ClientException(
                String.format("评测运行不存在: %d", runId), EvalErrorCode.RUN_NOT_FOUND));
    }

    /**
     * @return 运行在此期间已被其他流程写入终态时返回 false，不覆盖已有状态
     */
    private boolean markFailed(EvaluationRun run, String message) {
        run.transitionTo(RunStatus.FAILED);
        run.setErrorMessage(message);
        run.setFinishedAt(LocalDateTime.now());
        try {
            runRepository.save(run);
        } catch (OptimisticLockingFailureException e) {
            log.warn("评测运行 {} 已被并发更新，放弃置为失败", run.getId());
            return false;
        }
        progressTracker.fail(run.getId(), message);
        log.info("评测运行 {} 已置为失败: {}", run.getId(), message);
        return true;
    }

    private List<String> normalizeSpecies(List<String> species) {
        if (species == null) {
            return List.of();
        }
        return species.stream()
            .filter(StrUtil::isNotBlank)
            .map(DetectionNormalizer::canonicalClassName)
            .collect(Collectors.toList());
    }

    private ComparisonMetric parseMetric(String metricName) {
        if (StrUtil.isBlank(metricName)) {
            return ComparisonMetric.F1;
        }
        try {
            return ComparisonMetric.valueOf(metricName.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ClientException("不支持的评测指标: " + metricName, EvalErrorCode.METRIC_NOT_SUPPORTED);
        }
    }

    private Function<ModelMetrics, Double> metricField(ComparisonMetric metric) {
        switch (metric) {
            case PRECISION:
                return ModelMetrics::getPrecision;
            case RECALL:
                return ModelMetrics::getRecall;
            case MAP_50:
                return ModelMetrics::getMap50;
            case F1:
            default:
                return ModelMetrics::getF1Score;
        }
    }

    private static boolean isUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
