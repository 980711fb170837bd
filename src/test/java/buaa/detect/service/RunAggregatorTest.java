package buaa.detect.service;

import buaa.detect.dto.BoundingBox;
import buaa.detect.dto.Detection;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.MatchResult;
import buaa.detect.dto.ModelImageOutcome;
import buaa.detect.model.MetricsRowType;
import buaa.detect.model.ModelMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunAggregatorTest {

    private static final String EGRET = "chinese_egret";

    private final MetricsCalculator calculator = new MetricsCalculator();
    private final DetectionMatcher matcher = new DetectionMatcher();
    private final RunAggregator aggregator = new RunAggregator(calculator, new DetectionNormalizer());

    @Test
    void emptyFoldHasCountsButNoMetrics() {
        ModelMetrics row = aggregator.modelRow(1L, "yolov8l", MetricsRowType.FOLD, 3, List.of(), List.of());

        assertThat(row.getImagesProcessed()).isZero();
        assertThat(row.getTruePositives()).isZero();
        assertThat(row.getPrecision()).isNull();
        assertThat(row.getRecall()).isNull();
        assertThat(row.getF1Score()).isNull();
        assertThat(row.getMap50()).isNull();
        assertThat(row.getMap5095()).isNull();
        assertThat(row.getAvgInferenceTimeMs()).isNull();
    }

    @Test
    void emptyFoldWithSpeciesFilterWritesNoSpeciesRows() {
        assertThat(aggregator.speciesRows(1L, 10L, List.of(), List.of(EGRET))).isEmpty();
    }

    @Test
    void aggregateIgnoresEmptyFolds() {
        ModelMetrics first = aggregator.modelRow(1L, "yolov8l", MetricsRowType.FOLD, 0,
            List.of(perfect("a.jpg")), List.of());
        ModelMetrics second = aggregator.modelRow(1L, "yolov8l", MetricsRowType.FOLD, 1,
            List.of(perfect("b.jpg")), List.of());
        ModelMetrics empty = aggregator.modelRow(1L, "yolov8l", MetricsRowType.FOLD, 2, List.of(), List.of());

        ModelMetrics aggregate = aggregator.foldAggregateRow(1L, "yolov8l", List.of(first, empty, second));

        assertThat(aggregate.getRowType()).isEqualTo(MetricsRowType.KFOLD_AGGREGATE);
        assertThat(aggregate.getPrecision()).isEqualTo(1.0);
        assertThat(aggregate.getRecall()).isEqualTo(1.0);
        assertThat(aggregate.getF1Score()).isEqualTo(1.0);
        assertThat(aggregate.getPrecisionStd()).isEqualTo(0.0);
        assertThat(aggregate.getImagesProcessed()).isEqualTo(2);
        assertThat(aggregate.getTruePositives()).isEqualTo(2);
    }

    private ModelImageOutcome perfect(String filename) {
        GroundTruth truth = new GroundTruth(BoundingBox.ofCorners(10, 10, 40, 40), 0, EGRET);
        Detection prediction = new Detection(BoundingBox.ofCorners(10, 10, 40, 40), 0.9, 0, EGRET);
        MatchResult result = matcher.match(List.of(prediction), List.of(truth), 0.5);
        return new ModelImageOutcome("yolov8l", filename, 0, List.of(prediction), List.of(truth),
            result, calculator.scores(result), 12.0);
    }
}
