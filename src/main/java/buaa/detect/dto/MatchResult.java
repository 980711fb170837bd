package buaa.detect.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 单张图像单个模型的匹配结果
 */
@Getter
@ToString
public final class MatchResult {

    private final List<Match> matches;
    private final List<Detection> unmatchedPredictions;
    private final List<GroundTruth> unmatchedGroundTruth;

    public MatchResult(List<Match> matches,
                       List<Detection> unmatchedPredictions,
                       List<GroundTruth> unmatchedGroundTruth) {
        this.matches = List.copyOf(matches);
        this.unmatchedPredictions = List.copyOf(unmatchedPredictions);
        this.unmatchedGroundTruth = List.copyOf(unmatchedGroundTruth);
    }

    public int truePositives() {
        return matches.size();
    }

    public int falsePositives() {
        return unmatchedPredictions.size();
    }

    public int falseNegatives() {
        return unmatchedGroundTruth.size();
    }
}
