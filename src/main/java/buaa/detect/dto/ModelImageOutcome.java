package buaa.detect.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 单个模型在单张图像上的评测结果（已规范化的框、匹配结果、推理耗时）
 */
@Getter
@ToString
public final class ModelImageOutcome {

    private final String modelName;
    private final String filename;
    /** 所属折号，非K折评测为空 */
    private final Integer foldIndex;
    private final List<Detection> predictions;
    private final List<GroundTruth> groundTruths;
    private final MatchResult matchResult;
    private final DetectionScores scores;
    private final double inferenceTimeMs;

    public ModelImageOutcome(String modelName, String filename, Integer foldIndex,
                             List<Detection> predictions, List<GroundTruth> groundTruths,
                             MatchResult matchResult, DetectionScores scores, double inferenceTimeMs) {
        this.modelName = modelName;
        this.filename = filename;
        this.foldIndex = foldIndex;
        this.predictions = List.copyOf(predictions);
        this.groundTruths = List.copyOf(groundTruths);
        this.matchResult = matchResult;
        this.scores = scores;
        this.inferenceTimeMs = inferenceTimeMs;
    }

    public ImageDetections toImageDetections() {
        return new ImageDetections(filename, predictions, groundTruths);
    }
}
