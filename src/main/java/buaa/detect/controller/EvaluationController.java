package buaa.detect.controller;

import buaa.detect.common.convention.result.Result;
import buaa.detect.common.convention.result.Results;
import buaa.detect.dto.EvaluationProgress;
import buaa.detect.dto.EvaluationRunRequest;
import buaa.detect.dto.EvaluationRunResponse;
import buaa.detect.dto.ModelComparisonResponse;
import buaa.detect.dto.ModelMetricsResponse;
import buaa.detect.model.ConfusionMatrixEntry;
import buaa.detect.model.EvaluationRun;
import buaa.detect.model.ImageEvaluationResult;
import buaa.detect.service.EvaluationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 检测模型评测接口
 */
@RestController
@RequestMapping("/api/evaluations")
public class EvaluationController {

    private final EvaluationService evaluationService;

    public EvaluationController(EvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    /**
     * 创建评测运行
     * POST /api/evaluations，autoStart 默认为 true
     */
    @PostMapping
    public Result<EvaluationRunResponse> createEvaluation(@Valid @RequestBody EvaluationRunRequest request) {
        EvaluationRun run = evaluationService.createRun(request);
        if (!Boolean.FALSE.equals(request.getAutoStart())) {
            evaluationService.startEvaluation(run.getId());
        }
        return Results.success(EvaluationRunResponse.from(evaluationService.getRun(run.getId())));
    }

    @PostMapping("/{id}/start")
    public Result<EvaluationRunResponse> startEvaluation(@PathVariable("id") Long id) {
        evaluationService.startEvaluation(id);
        return Results.success(EvaluationRunResponse.from(evaluationService.getRun(id)));
    }

    @PostMapping("/{id}/cancel")
    public Result<Void> cancelEvaluation(@PathVariable("id") Long id) {
        evaluationService.cancelEvaluation(id);
        return Results.success();
    }

    @GetMapping("/{id}/progress")
    public Result<EvaluationProgress> getProgress(@PathVariable("id") Long id) {
        return Results.success(evaluationService.getProgress(id));
    }

    @GetMapping("/{id}")
    public Result<EvaluationRunResponse> getEvaluation(@PathVariable("id") Long id) {
        return Results.success(EvaluationRunResponse.from(evaluationService.getRun(id)));
    }

    @GetMapping
    public Result<List<EvaluationRunResponse>> listEvaluations() {
        return Results.success(evaluationService.listRuns().stream()
            .map(EvaluationRunResponse::from)
            .collect(Collectors.toList()));
    }

    @GetMapping("/{id}/models")
    public Result<List<ModelMetricsResponse>> getModelMetrics(@PathVariable("id") Long id) {
        return Results.success(evaluationService.getModelMetrics(id));
    }

    @GetMapping("/{id}/images")
    public Result<List<ImageEvaluationResult>> getImageResults(@PathVariable("id") Long id,
                                                               @RequestParam(value = "model", required = false) String model) {
        return Results.success(evaluationService.getImageResults(id, model));
    }

    @GetMapping("/{id}/confusion")
    public Result<List<ConfusionMatrixEntry>> getConfusionMatrix(@PathVariable("id") Long id,
                                                                 @RequestParam(value = "model", required = false) String model) {
        return Results.success(evaluationService.getConfusionMatrix(id, model));
    }

    /**
     * K折评测模型比较
     * GET /api/evaluations/{id}/comparison?metric=F1&alpha=0.05
     */
    @GetMapping("/{id}/comparison")
    public Result<ModelComparisonResponse> compareModels(@PathVariable("id") Long id,
                                                         @RequestParam(value = "metric", required = false) String metric,
                                                         @RequestParam(value = "alpha", required = false) Double alpha) {
        return Results.success(evaluationService.compareModels(id, metric, alpha));
    }

    @DeleteMapping("/{id}")
    public Result<Void> deleteEvaluation(@PathVariable("id") Long id) {
        evaluationService.deleteRun(id);
        return Results.success();
    }
}
