package buaa.detect.service;

import buaa.detect.dto.BoxSnapshot;
import buaa.detect.dto.ConfusionCell;
import buaa.detect.dto.Detection;
import buaa.detect.dto.DetectionScores;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.ImageDetections;
import buaa.detect.dto.LabeledBox;
import buaa.detect.dto.Match;
import buaa.detect.dto.MatchSnapshot;
import buaa.detect.dto.ModelImageOutcome;
import buaa.detect.model.ConfusionMatrixEntry;
import buaa.detect.model.EvaluationRun;
import buaa.detect.model.ImageEvaluationResult;
import buaa.detect.model.MetricsRowType;
import buaa.detect.model.ModelMetrics;
import buaa.detect.model.SpeciesMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 将逐图评测结果汇总为模型级、物种级与运行级指标
 *
 * <p>只构造实体，不负责持久化。</p>
 */
@Component
public class RunAggregator {

    private final MetricsCalculator metricsCalculator;
    private final DetectionNormalizer normalizer;

    public RunAggregator(MetricsCalculator metricsCalculator, DetectionNormalizer normalizer) {
        this.metricsCalculator = metricsCalculator;
        this.normalizer = normalizer;
    }

    public ImageEvaluationResult imageRow(Long runId, ModelImageOutcome outcome) {
        ImageEvaluationResult row = new ImageEvaluationResult();
        row.setRunId(runId);
        row.setModelName(outcome.getModelName());
        row.setFoldIndex(outcome.getFoldIndex());
        row.setImageFilename(outcome.getFilename());
        row.setGroundTruthBoxes(snapshots(outcome.getGroundTruths()));
        row.setGroundTruthCount(outcome.getGroundTruths().size());
        row.setPredictedBoxes(snapshots(outcome.getPredictions()));
        row.setPredictedCount(outcome.getPredictions().size());
        row.setMatches(outcome.getMatchResult().getMatches().stream()
            .map(MatchSnapshot::of)
            .collect(Collectors.toList()));
        row.setUnmatchedPredictions(snapshots(outcome.getMatchResult().getUnmatchedPredictions()));
        row.setUnmatchedGroundTruth(snapshots(outcome.getMatchResult().getUnmatchedGroundTruth()));
        row.setImagePrecision(outcome.getScores().getPrecision());
        row.setImageRecall(outcome.getScores().getRecall());
        row.setImageF1(outcome.getScores().getF1Score());
        row.setAvgIou(metricsCalculator.averageIou(outcome.getMatchResult().getMatches()));
        row.setInferenceTimeMs(outcome.getInferenceTimeMs());
        return row;
    }

    /**
     * 模型在一组图像上的指标行（OVERALL 或单折 FOLD）
     */
    public ModelMetrics modelRow(Long runId, String modelName, MetricsRowType rowType, Integer foldIndex,
                                 List<ModelImageOutcome> outcomes, Collection<String> speciesFilter) {
        int tp = 0;
        int fp = 0;
        int fn = 0;
        int groundTruths = 0;
        int predictions = 0;
        double inferenceSum = 0.0;
        double confidenceSum = 0.0;
        for (ModelImageOutcome outcome : outcomes) {
            tp += outcome.getScores().getTruePositives();
            fp += outcome.getScores().getFalsePositives();
            fn += outcome.getScores().getFalseNegatives();
            groundTruths += outcome.getGroundTruths().size();
            predictions += outcome.getPredictions().size();
            inferenceSum += outcome.getInferenceTimeMs();
            for (Detection prediction : outcome.getPredictions()) {
                confidenceSum += prediction.getConfidence();
            }
        }
        DetectionScores scores = metricsCalculator.scores(tp, fp, fn);
        List<ImageDetections> images = toImageDetections(outcomes);
        Set<String> classes = classesOf(outcomes, speciesFilter);

        ModelMetrics row = new ModelMetrics();
        row.setRunId(runId);
        row.setModelName(modelName);
        row.setRowType(rowType);
        row.setFoldIndex(foldIndex);
        row.setImagesProcessed(outcomes.size());
        row.setGroundTruthObjects(groundTruths);
        row.setPredictedObjects(predictions);
        row.setTruePositives(tp);
        row.setFalsePositives(fp);
        row.setFalseNegatives(fn);
        // 空折不产生指标
        if (outcomes.isEmpty()) {
            return row;
        }
        row.setPrecision(scores.getPrecision());
        row.setRecall(scores.getRecall());
        row.setF1Score(scores.getF1Score());
        row.setMap50(metricsCalculator.meanAveragePrecision(images, classes, MetricsCalculator.MAP_50_IOU));
        row.setMap5095(metricsCalculator.meanAveragePrecisionCoco(images, classes));
        row.setAvgInferenceTimeMs(inferenceSum / outcomes.size());
        row.setAvgConfidenceScore(predictions == 0 ? null : confidenceSum / predictions);
        return row;
    }

    /**
     * K折汇总行：各指标取各折的均值与样本标准差，计数为各折之和。
     * 指标为空的折（没有图像）不计入均值与标准差。
     */
    public ModelMetrics foldAggregateRow(Long runId, String modelName, List<ModelMetrics> foldRows) {
        ModelMetrics row = new ModelMetrics();
        row.setRunId(runId);
        row.setModelName(modelName + ModelMetrics.KFOLD_AGGREGATE_SUFFIX);
        row.setRowType(MetricsRowType.KFOLD_AGGREGATE);
        row.setImagesProcessed(sum(foldRows, ModelMetrics::getImagesProcessed));
        row.setGroundTruthObjects(sum(foldRows, ModelMetrics::getGroundTruthObjects));
        row.setPredictedObjects(sum(foldRows, ModelMetrics::getPredictedObjects));
        row.setTruePositives(sum(foldRows, ModelMetrics::getTruePositives));
        row.setFalsePositives(sum(foldRows, ModelMetrics::getFalsePositives));
        row.setFalseNegatives(sum(foldRows, ModelMetrics::getFalseNegatives));

        row.setPrecision(mean(foldRows, ModelMetrics::getPrecision));
        row.setRecall(mean(foldRows, ModelMetrics::getRecall));
        row.setF1Score(mean(foldRows, ModelMetrics::getF1Score));
        row.setMap50(mean(foldRows, ModelMetrics::getMap50));
        row.setMap5095(mean(foldRows, ModelMetrics::getMap5095));
        row.setPrecisionStd(std(foldRows, ModelMetrics::getPrecision));
        row.setRecallStd(std(foldRows, ModelMetrics::getRecall));
        row.setF1Std(std(foldRows, ModelMetrics::getF1Score));
        row.setMap50Std(std(foldRows, ModelMetrics::getMap50));
        row.setAvgInferenceTimeMs(mean(foldRows, ModelMetrics::getAvgInferenceTimeMs));
        row.setAvgConfidenceScore(mean(foldRows, ModelMetrics::getAvgConfidenceScore));
        return row;
    }

    /**
     * 物种级指标；指定物种过滤时按过滤列表，否则按结果中出现过的全部类别。空折不产生物种行
     */
    public List<SpeciesMetrics> speciesRows(Long runId, Long modelMetricsId,
                                            List<ModelImageOutcome> outcomes,
                                            Collection<String> speciesFilter) {
        if (outcomes.isEmpty()) {
            return new ArrayList<>();
        }
        List<ImageDetections> images = toImageDetections(outcomes);
        List<SpeciesMetrics> rows = new ArrayList<>();
        for (String className : classesOf(outcomes, speciesFilter)) {
            int tp = 0;
            int fp = 0;
            int fn = 0;
            int groundTruths = 0;
            int detected = 0;
            double confidenceSum = 0.0;
            Integer classId = null;

            for (ModelImageOutcome outcome : outcomes) {
                for (Match match : outcome.getMatchResult().getMatches()) {
                    if (className.equals(match.getGroundTruth().getClassName())) {
                        tp++;
                    }
                }
                for (Detection prediction : outcome.getMatchResult().getUnmatchedPredictions()) {
                    if (className.equals(prediction.getClassName())) {
                        fp++;
                    }
                }
                for (GroundTruth groundTruth : outcome.getMatchResult().getUnmatchedGroundTruth()) {
                    if (className.equals(groundTruth.getClassName())) {
                        fn++;
                    }
                }
                for (GroundTruth groundTruth : outcome.getGroundTruths()) {
                    if (className.equals(groundTruth.getClassName())) {
                        groundTruths++;
                        classId = classId == null ? groundTruth.getClassId() : classId;
                    }
                }
                for (Detection prediction : outcome.getPredictions()) {
                    if (className.equals(prediction.getClassName())) {
                        detected++;
                        confidenceSum += prediction.getConfidence();
                        classId = classId == null ? prediction.getClassId() : classId;
                    }
                }
            }

            DetectionScores scores = metricsCalculator.scores(tp, fp, fn);
            SpeciesMetrics row = new SpeciesMetrics();
            row.setRunId(runId);
            row.setModelMetricsId(modelMetricsId);
            row.setClassName(className);
            row.setClassId(classId);
            row.setTruePositives(tp);
            row.setFalsePositives(fp);
            row.setFalseNegatives(fn);
            row.setPrecision(scores.getPrecision());
            row.setRecall(scores.getRecall());
            row.setF1Score(scores.getF1Score());
            row.setAveragePrecision(
                metricsCalculator.averagePrecision(images, className, MetricsCalculator.MAP_50_IOU));
            row.setAvgConfidence(detected == 0 ? null : confidenceSum / detected);
            row.setGroundTruthCount(groundTruths);
            row.setDetectedCount(detected);
            rows.add(row);
        }
        return rows;
    }

    public List<ConfusionMatrixEntry> confusionEntries(Long runId, String modelName,
                                                       List<ModelImageOutcome> outcomes,
                                                       double iouThreshold) {
        Map<String, ConfusionCell> cells = new LinkedHashMap<>();
        for (ModelImageOutcome outcome : outcomes) {
            metricsCalculator.accumulateConfusion(cells, outcome.getMatchResult(), iouThreshold);
        }
        int total = cells.values().stream().mapToInt(ConfusionCell::getCount).sum();

        List<ConfusionMatrixEntry> entries = new ArrayList<>(cells.size());
        for (ConfusionCell cell : cells.values()) {
            ConfusionMatrixEntry entry = new ConfusionMatrixEntry();
            entry.setRunId(runId);
            entry.setModelName(modelName);
            entry.setActualClass(cell.getActualClass());
            entry.setPredictedClass(cell.getPredictedClass());
            entry.setCount(cell.getCount());
            entry.setPercentage(total == 0 ? 0.0 : cell.getCount() * 100.0 / total);
            entry.setAvgConfidence(cell.averageConfidence());
            entry.setAvgIou(cell.averageIou());
            entries.add(entry);
        }
        return entries;
    }

    /**
     * 运行级汇总：P/R/F1 由各模型主指标行的 TP/FP/FN 之和计算，mAP 取各模型均值。
     * 没有任何成功评测的图像时指标保持为空。
     */
    public void applyRunTotals(EvaluationRun run, List<ModelMetrics> primaryRows,
                               int imagesEvaluated, int groundTruthObjects) {
        run.setTotalImagesEvaluated(imagesEvaluated);
        run.setTotalGroundTruthObjects(groundTruthObjects);
        run.setTotalPredictedObjects(sum(primaryRows, ModelMetrics::getPredictedObjects));
        if (imagesEvaluated == 0 || primaryRows.isEmpty()) {
            run.setOverallPrecision(null);
            run.setOverallRecall(null);
            run.setOverallF1Score(null);
            run.setOverallMap50(null);
            run.setOverallMap5095(null);
            return;
        }

        DetectionScores scores = metricsCalculator.scores(
            sum(primaryRows, ModelMetrics::getTruePositives),
            sum(primaryRows, ModelMetrics::getFalsePositives),
            sum(primaryRows, ModelMetrics::getFalseNegatives));
        run.setOverallPrecision(scores.getPrecision());
        run.setOverallRecall(scores.getRecall());
        run.setOverallF1Score(scores.getF1Score());
        run.setOverallMap50(mean(primaryRows, ModelMetrics::getMap50));
        run.setOverallMap5095(mean(primaryRows, ModelMetrics::getMap5095));
    }

    private Set<String> classesOf(List<ModelImageOutcome> outcomes, Collection<String> speciesFilter) {
        Set<String> filter = normalizer.canonicalSet(speciesFilter);
        if (!filter.isEmpty()) {
            return new TreeSet<>(filter);
        }
        Set<String> classes = new TreeSet<>();
        for (ModelImageOutcome outcome : outcomes) {
            outcome.getGroundTruths().forEach(gt -> classes.add(gt.getClassName()));
            outcome.getPredictions().forEach(p -> classes.add(p.getClassName()));
        }
        return classes;
    }

    private List<ImageDetections> toImageDetections(List<ModelImageOutcome> outcomes) {
        return outcomes.stream()
            .map(ModelImageOutcome::toImageDetections)
            .collect(Collectors.toList());
    }

    private List<BoxSnapshot> snapshots(List<? extends LabeledBox> boxes) {
        return boxes.stream().map(BoxSnapshot::of).collect(Collectors.toList());
    }

    private int sum(List<ModelMetrics> rows, Function<ModelMetrics, Integer> field) {
        return rows.stream()
            .map(field)
            .filter(v -> v != null)
            .mapToInt(Integer::intValue)
            .sum();
    }

    private Double mean(List<ModelMetrics> rows, Function<ModelMetrics, Double> field) {
        return metricsCalculator.meanIgnoringNull(rows.stream().map(field).collect(Collectors.toList()));
    }

    private Double std(List<ModelMetrics> rows, Function<ModelMetrics, Double> field) {
        double[] values = rows.stream()
            .map(field)
            .filter(v -> v != null)
            .mapToDouble(Double::doubleValue)
            .toArray();
        return values.length == 0 ? null : metricsCalculator.sampleStandardDeviation(values);
    }
}
