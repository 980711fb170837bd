package buaa.detect.dto;

import buaa.detect.model.EvaluationRun;
import buaa.detect.model.RunStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 评测运行读模型
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationRunResponse {

    static final String NO_DATA_HINT =
        "本次评测没有成功评测的图像，指标为空而不是0。请检查所选日期范围、物种过滤与标注数据后重新评测。";

    private Long id;
    private String name;
    private String description;
    private RunStatus status;
    private Double iouThreshold;
    private Double confidenceThreshold;
    private List<String> modelsEvaluated;
    private List<String> speciesFilter;
    private LocalDateTime dateRangeStart;
    private LocalDateTime dateRangeEnd;
    private Integer foldCount;
    private String device;

    private Double overallPrecision;
    private Double overallRecall;
    private Double overallF1Score;
    private Double overallMap50;
    private Double overallMap5095;
    private Integer totalImagesEvaluated;
    private Integer totalGroundTruthObjects;
    private Integer totalPredictedObjects;
    private Integer skippedImages;

    /** 仅 FAILED 时有值 */
    private String errorMessage;
    /** 仅 COMPLETED 且没有任何评测数据时有值 */
    private String noDataHint;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private Long processingDurationMs;

    public static EvaluationRunResponse from(EvaluationRun run) {
        EvaluationRunResponse response = new EvaluationRunResponse();
        response.setId(run.getId());
        response.setName(run.getName());
        response.setDescription(run.getDescription());
        response.setStatus(run.getStatus());
        response.setIouThreshold(run.getIouThreshold());
        response.setConfidenceThreshold(run.getConfidenceThreshold());
        response.setModelsEvaluated(run.getModelsEvaluated());
        response.setSpeciesFilter(run.getSpeciesFilter());
        response.setDateRangeStart(run.getDateRangeStart());
        response.setDateRangeEnd(run.getDateRangeEnd());
        response.setFoldCount(run.getFoldCount());
        response.setDevice(run.getDevice());
        response.setOverallPrecision(run.getOverallPrecision());
        response.setOverallRecall(run.getOverallRecall());
        response.setOverallF1Score(run.getOverallF1Score());
        response.setOverallMap50(run.getOverallMap50());
        response.setOverallMap5095(run.getOverallMap5095());
        response.setTotalImagesEvaluated(run.getTotalImagesEvaluated());
        response.setTotalGroundTruthObjects(run.getTotalGroundTruthObjects());
        response.setTotalPredictedObjects(run.getTotalPredictedObjects());
        response.setSkippedImages(run.getSkippedImages());
        response.setCreatedAt(run.getCreatedAt());
        response.setStartedAt(run.getStartedAt());
        response.setFinishedAt(run.getFinishedAt());
        response.setProcessingDurationMs(run.getProcessingDurationMs());

        if (run.getStatus() == RunStatus.FAILED) {
            response.setErrorMessage(run.getErrorMessage());
        }
        Integer evaluated = run.getTotalImagesEvaluated();
        if (run.getStatus() == RunStatus.COMPLETED && (evaluated == null || evaluated == 0)) {
            response.setNoDataHint(NO_DATA_HINT);
        }
        return response;
    }
}
