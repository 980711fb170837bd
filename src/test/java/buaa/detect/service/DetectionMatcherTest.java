package buaa.detect.service;

import buaa.detect.dto.BoundingBox;
import buaa.detect.dto.Detection;
import buaa.detect.dto.DetectionScores;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DetectionMatcherTest {

    private final DetectionMatcher matcher = new DetectionMatcher();
    private final MetricsCalculator calculator = new MetricsCalculator();

    @Test
    void singlePredictionAgainstTwoGroundTruths() {
        List<GroundTruth> truths = List.of(
            new GroundTruth(BoundingBox.ofPixelRect(10, 10, 50, 50), 0, "a"),
            new GroundTruth(BoundingBox.ofPixelRect(100, 100, 50, 50), 0, "a"));
        List<Detection> predictions = List.of(
            new Detection(BoundingBox.ofPixelRect(12, 12, 48, 48), 0.9, 0, "a"));

        MatchResult result = matcher.match(predictions, truths, 0.5);
        DetectionScores scores = calculator.scores(result);

        assertThat(result.getMatches()).hasSize(1);
        assertThat(result.getMatches().get(0).getGroundTruth()).isSameAs(truths.get(0));
        assertThat(result.getMatches().get(0).getIou()).isGreaterThan(0.8).isLessThanOrEqualTo(1.0);
        assertThat(scores.getTruePositives()).isEqualTo(1);
        assertThat(scores.getFalsePositives()).isZero();
        assertThat(scores.getFalseNegatives()).isEqualTo(1);
        assertThat(scores.getPrecision()).isEqualTo(1.0);
        assertThat(scores.getRecall()).isEqualTo(0.5);
        assertThat(scores.getF1Score()).isCloseTo(0.6667, within(1e-3));
    }

    @Test
    void differentClassesNeverMatch() {
        List<GroundTruth> truths = List.of(new GroundTruth(BoundingBox.ofCorners(0, 0, 10, 10), 0, "a"));
        List<Detection> predictions = List.of(new Detection(BoundingBox.ofCorners(0, 0, 10, 10), 0.99, 1, "b"));

        MatchResult result = matcher.match(predictions, truths, 0.5);

        assertThat(result.getMatches()).isEmpty();
        assertThat(result.falsePositives()).isEqualTo(1);
        assertThat(result.falseNegatives()).isEqualTo(1);
    }

    @Test
    void higherConfidencePredictionClaimsGroundTruthFirst() {
        GroundTruth truth = new GroundTruth(BoundingBox.ofCorners(0, 0, 10, 10), 0, "a");
        Detection weakExact = new Detection(BoundingBox.ofCorners(0, 0, 10, 10), 0.3, 0, "a");
        Detection strongLoose = new Detection(BoundingBox.ofCorners(1, 1, 10, 10), 0.8, 0, "a");

        MatchResult result = matcher.match(List.of(weakExact, strongLoose), List.of(truth), 0.5);

        assertThat(result.getMatches()).hasSize(1);
        assertThat(result.getMatches().get(0).getPrediction()).isSameAs(strongLoose);
        assertThat(result.getUnmatchedPredictions()).containsExactly(weakExact);
    }

    @Test
    void countsAreConsistentWithInputSizes() {
        List<GroundTruth> truths = List.of(
            new GroundTruth(BoundingBox.ofCorners(0, 0, 10, 10), 0, "a"),
            new GroundTruth(BoundingBox.ofCorners(20, 20, 30, 30), 0, "a"),
            new GroundTruth(BoundingBox.ofCorners(40, 40, 50, 50), 1, "b"));
        List<Detection> predictions = List.of(
            new Detection(BoundingBox.ofCorners(0, 0, 10, 10), 0.9, 0, "a"),
            new Detection(BoundingBox.ofCorners(1, 1, 11, 11), 0.8, 0, "a"),
            new Detection(BoundingBox.ofCorners(40, 40, 50, 50), 0.7, 1, "b"),
            new Detection(BoundingBox.ofCorners(70, 70, 80, 80), 0.6, 1, "b"));

        MatchResult result = matcher.match(predictions, truths, 0.5);

        assertThat(result.truePositives() + result.falsePositives()).isEqualTo(predictions.size());
        assertThat(result.truePositives() + result.falseNegatives()).isEqualTo(truths.size());
        assertThat(result.getMatches())
            .extracting(m -> m.getGroundTruth())
            .doesNotHaveDuplicates();
    }

    @Test
    void overlapBelowThresholdIsNotAMatch() {
        GroundTruth truth = new GroundTruth(BoundingBox.ofCorners(0, 0, 10, 10), 0, "a");
        Detection shifted = new Detection(BoundingBox.ofCorners(5, 5, 15, 15), 0.9, 0, "a");

        MatchResult result = matcher.match(List.of(shifted), List.of(truth), 0.5);

        assertThat(result.getMatches()).isEmpty();
    }
}
