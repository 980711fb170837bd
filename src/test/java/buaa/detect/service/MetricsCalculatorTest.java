package buaa.detect.service;

import buaa.detect.dto.BoundingBox;
import buaa.detect.dto.ConfusionCell;
import buaa.detect.dto.Detection;
import buaa.detect.dto.DetectionScores;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.ImageDetections;
import buaa.detect.dto.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();
    private final DetectionMatcher matcher = new DetectionMatcher();

    private static GroundTruth gt(double x1, double y1, double x2, double y2, String cls) {
        return new GroundTruth(BoundingBox.ofCorners(x1, y1, x2, y2), 0, cls);
    }

    private static Detection det(double x1, double y1, double x2, double y2, double conf, String cls) {
        return new Detection(BoundingBox.ofCorners(x1, y1, x2, y2), conf, 0, cls);
    }

    @Test
    void scoresAreZeroWhenDenominatorsAreZero() {
        DetectionScores scores = calculator.scores(0, 0, 0);

        assertThat(scores.getPrecision()).isZero();
        assertThat(scores.getRecall()).isZero();
        assertThat(scores.getF1Score()).isZero();
    }

    @Test
    void negativeCountsAreClamped() {
        DetectionScores scores = calculator.scores(-1, 2, 0);

        assertThat(scores.getTruePositives()).isZero();
        assertThat(scores.getPrecision()).isZero();
    }

    @Test
    void f1IsZeroWhenPrecisionOrRecallIsZero() {
        assertThat(calculator.f1(0.0, 0.9)).isZero();
        assertThat(calculator.f1(0.9, 0.0)).isZero();
    }

    @Test
    void perfectPredictionsGiveApOfOne() {
        List<ImageDetections> images = List.of(
            new ImageDetections("a.jpg",
                List.of(det(0, 0, 10, 10, 0.9, "egret")),
                List.of(gt(0, 0, 10, 10, "egret"))),
            new ImageDetections("b.jpg",
                List.of(det(5, 5, 20, 20, 0.8, "egret")),
                List.of(gt(5, 5, 20, 20, "egret"))));

        assertThat(calculator.averagePrecision(images, "egret", 0.5)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void falsePositiveRankedFirstLowersAp() {
        // 置信度最高的预测是误检，随后两个正确检测：P 序列 0, 1/2, 2/3，包络后 AP = 2/3
        List<ImageDetections> images = List.of(
            new ImageDetections("a.jpg",
                List.of(det(50, 50, 60, 60, 0.95, "egret"), det(0, 0, 10, 10, 0.9, "egret")),
                List.of(gt(0, 0, 10, 10, "egret"))),
            new ImageDetections("b.jpg",
                List.of(det(0, 0, 10, 10, 0.7, "egret")),
                List.of(gt(0, 0, 10, 10, "egret"))));

        assertThat(calculator.averagePrecision(images, "egret", 0.5)).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void predictionCannotMatchGroundTruthInAnotherImage() {
        List<ImageDetections> images = List.of(
            new ImageDetections("a.jpg", List.of(det(0, 0, 10, 10, 0.9, "egret")), List.of()),
            new ImageDetections("b.jpg", List.of(), List.of(gt(0, 0, 10, 10, "egret"))));

        assertThat(calculator.averagePrecision(images, "egret", 0.5)).isZero();
    }

    @Test
    void classWithoutGroundTruthIsExcludedFromMap() {
        List<ImageDetections> images = List.of(
            new ImageDetections("a.jpg",
                List.of(det(0, 0, 10, 10, 0.9, "egret"), det(30, 30, 40, 40, 0.9, "tern")),
                List.of(gt(0, 0, 10, 10, "egret"))));

        Map<String, Double> perClass = calculator.averagePrecisionByClass(images, List.of("egret", "tern"), 0.5);

        assertThat(perClass.get("egret")).isCloseTo(1.0, within(1e-9));
        assertThat(perClass.get("tern")).isNull();
        assertThat(calculator.meanAveragePrecision(images, List.of("egret", "tern"), 0.5))
            .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void mapIsNullWhenNoClassHasGroundTruth() {
        List<ImageDetections> images = List.of(
            new ImageDetections("a.jpg", List.of(det(0, 0, 10, 10, 0.9, "egret")), List.of()));

        assertThat(calculator.meanAveragePrecision(images, List.of("egret"), 0.5)).isNull();
    }

    @Test
    void cocoMapDoesNotExceedMap50() {
        List<ImageDetections> images = List.of(
            new ImageDetections("a.jpg",
                List.of(det(1, 1, 11, 11, 0.9, "egret"), det(20, 22, 30, 30, 0.6, "egret")),
                List.of(gt(0, 0, 10, 10, "egret"), gt(20, 20, 30, 30, "egret"))));
        List<String> classes = List.of("egret");

        Double map50 = calculator.meanAveragePrecision(images, classes, 0.5);
        Double map5095 = calculator.meanAveragePrecisionCoco(images, classes);

        assertThat(map5095).isNotNull();
        assertThat(map5095).isLessThanOrEqualTo(map50);
    }

    @Test
    void sampleStandardDeviationUsesBesselCorrection() {
        assertThat(calculator.sampleStandardDeviation(new double[] {1, 2, 3})).isCloseTo(1.0, within(1e-12));
        assertThat(calculator.sampleStandardDeviation(new double[] {5})).isZero();
    }

    @Test
    void confusionMatrixSeparatesMissesFalseAlarmsAndClassConfusions() {
        List<GroundTruth> truths = List.of(
            gt(0, 0, 10, 10, "egret"),
            gt(20, 20, 30, 30, "egret"),
            gt(50, 50, 60, 60, "tern"));
        List<Detection> predictions = List.of(
            det(0, 0, 10, 10, 0.9, "egret"),
            det(20, 20, 30, 30, 0.8, "tern"),
            det(80, 80, 90, 90, 0.4, "egret"));
        MatchResult result = matcher.match(predictions, truths, 0.5);

        Map<String, ConfusionCell> cells = calculator.accumulateConfusion(new LinkedHashMap<>(), result, 0.5);

        assertThat(cells.get("egret->egret").getCount()).isEqualTo(1);
        assertThat(cells.get("egret->tern").getCount()).isEqualTo(1);
        assertThat(cells.get("egret->tern").averageIou()).isCloseTo(1.0, within(1e-9));
        assertThat(cells.get("tern->" + ConfusionCell.BACKGROUND).getCount()).isEqualTo(1);
        assertThat(cells.get(ConfusionCell.BACKGROUND + "->egret").getCount()).isEqualTo(1);
        assertThat(cells.values().stream().mapToInt(ConfusionCell::getCount).sum()).isEqualTo(4);
    }
}
