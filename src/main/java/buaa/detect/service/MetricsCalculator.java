package buaa.detect.service;

import buaa.detect.dto.ConfusionCell;
import buaa.detect.dto.Detection;
import buaa.detect.dto.DetectionScores;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.ImageDetections;
import buaa.detect.dto.Match;
import buaa.detect.dto.MatchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 检测指标计算：精确率/召回率/F1、单类AP、mAP 以及混淆矩阵
 */
@Slf4j
@Component
public class MetricsCalculator {

    /** COCO 风格 mAP@0.5:0.95 使用的 IoU 阈值 */
    public static final double[] COCO_IOU_THRESHOLDS = {
        0.50, 0.55, 0.60, 0.65, 0.70, 0.75, 0.80, 0.85, 0.90, 0.95
    };

    public static final double MAP_50_IOU = 0.5;

    public DetectionScores scores(MatchResult result) {
        return scores(result.truePositives(), result.falsePositives(), result.falseNegatives());
    }

    /**
     * 由混淆计数计算精确率、召回率与F1；分母为0时对应指标为0
     */
    public DetectionScores scores(int tp, int fp, int fn) {
        tp = nonNegative(tp, "TP");
        fp = nonNegative(fp, "FP");
        fn = nonNegative(fn, "FN");
        double precision = tp + fp > 0 ? (double) tp / (tp + fp) : 0.0;
        double recall = tp + fn > 0 ? (double) tp / (tp + fn) : 0.0;
        return new DetectionScores(tp, fp, fn, precision, recall, f1(precision, recall));
    }

    public double f1(double precision, double recall) {
        return precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
    }

    /**
     * 计算单个类别在若干图像上的平均精度（AP）
     *
     * <p>该类别所有预测按置信度降序扫描，预测只能匹配同一图像内尚未被占用的同类真实框。
     * 在 recall=0 处补首个精确率点、recall=1 处补精确率0，再从后向前取精确率包络，
     * 按召回率增量对阶梯函数求面积。</p>
     *
     * @return AP；该类别没有真实框时返回 null
     */
    public Double averagePrecision(List<ImageDetections> images, String className, double iouThreshold) {
        List<List<GroundTruth>> classTruths = new ArrayList<>(images.size());
        List<ScoredPrediction> classPredictions = new ArrayList<>();
        int groundTruthCount = 0;

        for (int imageIndex = 0; imageIndex < images.size(); imageIndex++) {
            ImageDetections image = images.get(imageIndex);
            List<GroundTruth> truths = new ArrayList<>();
            for (GroundTruth groundTruth : image.getGroundTruths()) {
                if (className.equals(groundTruth.getClassName())) {
                    truths.add(groundTruth);
                }
            }
            classTruths.add(truths);
            groundTruthCount += truths.size();
            for (Detection prediction : image.getPredictions()) {
                if (className.equals(prediction.getClassName())) {
                    classPredictions.add(new ScoredPrediction(imageIndex, prediction));
                }
            }
        }

        if (groundTruthCount == 0) {
            return null;
        }
        if (classPredictions.isEmpty()) {
            return 0.0;
        }

        classPredictions.sort(Comparator.comparingDouble(
            (ScoredPrediction p) -> p.detection.getConfidence()).reversed());

        List<boolean[]> claimed = new ArrayList<>(classTruths.size());
        for (List<GroundTruth> truths : classTruths) {
            claimed.add(new boolean[truths.size()]);
        }

        int tp = 0;
        int fp = 0;
        double[] precisions = new double[classPredictions.size() + 2];
        double[] recalls = new double[classPredictions.size() + 2];

        for (int i = 0; i < classPredictions.size(); i++) {
            ScoredPrediction scored = classPredictions.get(i);
            List<GroundTruth> truths = classTruths.get(scored.imageIndex);
            boolean[] used = claimed.get(scored.imageIndex);

            int bestIndex = -1;
            double bestIou = 0.0;
            for (int g = 0; g < truths.size(); g++) {
                if (used[g]) {
                    continue;
                }
                double iou = BoxGeometry.iou(scored.detection.getBbox(), truths.get(g).getBbox());
                if (iou > bestIou) {
                    bestIou = iou;
                    bestIndex = g;
                }
            }

            if (bestIndex >= 0 && bestIou >= iouThreshold) {
                used[bestIndex] = true;
                tp++;
            } else {
                fp++;
            }
            precisions[i + 1] = (double) tp / (tp + fp);
            recalls[i + 1] = (double) tp / groundTruthCount;
        }

        int last = precisions.length - 1;
        precisions[0] = precisions[1];
        recalls[0] = 0.0;
        precisions[last] = 0.0;
        recalls[last] = 1.0;

        for (int i = last - 1; i >= 0; i--) {
            precisions[i] = Math.max(precisions[i], precisions[i + 1]);
        }

        double ap = 0.0;
        for (int i = 1; i <= last; i++) {
            ap += (recalls[i] - recalls[i - 1]) * precisions[i];
        }
        return ap;
    }

    /**
     * 各类别AP
     *
     * @return 类别 -> AP（无真实框的类别为 null），保持输入类别顺序
     */
    public Map<String, Double> averagePrecisionByClass(List<ImageDetections> images,
                                                       Collection<String> classNames,
                                                       double iouThreshold) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (String className : classNames) {
            result.put(className, averagePrecision(images, className, iouThreshold));
        }
        return result;
    }

    /**
     * mAP：仅对存在真实框的类别求平均，无真实框的类别不计入（而不是记为0）
     *
     * @return mAP；所有类别都没有真实框时返回 null
     */
    public Double meanAveragePrecision(List<ImageDetections> images,
                                       Collection<String> classNames,
                                       double iouThreshold) {
        return meanIgnoringNull(averagePrecisionByClass(images, classNames, iouThreshold).values());
    }

    /**
     * mAP@0.5:0.95，即各 COCO IoU 阈值下 mAP 的平均
     */
    public Double meanAveragePrecisionCoco(List<ImageDetections> images, Collection<String> classNames) {
        List<Double> maps = new ArrayList<>(COCO_IOU_THRESHOLDS.length);
        for (double threshold : COCO_IOU_THRESHOLDS) {
            maps.add(meanAveragePrecision(images, classNames, threshold));
        }
        return meanIgnoringNull(maps);
    }

    public Double averageIou(List<Match> matches) {
        if (matches == null || matches.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        for (Match match : matches) {
            sum += match.getIou();
        }
        return sum / matches.size();
    }

    public Double meanIgnoringNull(Collection<Double> values) {
        double[] present = values.stream()
            .filter(v -> v != null)
            .mapToDouble(Double::doubleValue)
            .toArray();
        return present.length == 0 ? null : StatUtils.mean(present);
    }

    /**
     * 样本标准差（n-1）；样本数小于2时为0
     */
    public double sampleStandardDeviation(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.sqrt(StatUtils.variance(values));
    }

    /**
     * 由单图匹配结果累计混淆矩阵
     *
     * <p>已匹配对计入对角线；未匹配真实框若与未匹配的异类预测 IoU 不低于阈值，
     * 计为类别混淆（每个预测只使用一次）；其余未匹配真实框计为漏检（预测为背景），
     * 剩余未匹配预测计为误检（真实为背景）。</p>
     */
    public Map<String, ConfusionCell> accumulateConfusion(Map<String, ConfusionCell> cells,
                                                          MatchResult result,
                                                          double iouThreshold) {
        for (Match match : result.getMatches()) {
            cell(cells, match.getGroundTruth().getClassName(), match.getPrediction().getClassName())
                .add(match.getPrediction().getConfidence(), match.getIou());
        }

        List<Detection> remaining = new ArrayList<>(result.getUnmatchedPredictions());
        for (GroundTruth groundTruth : result.getUnmatchedGroundTruth()) {
            Detection confused = null;
            double confusedIou = 0.0;
            for (Detection prediction : remaining) {
                if (prediction.getClassName().equals(groundTruth.getClassName())) {
                    continue;
                }
                double iou = BoxGeometry.iou(prediction.getBbox(), groundTruth.getBbox());
                if (iou >= iouThreshold && iou > confusedIou) {
                    confused = prediction;
                    confusedIou = iou;
                }
            }
            if (confused != null) {
                remaining.remove(confused);
                cell(cells, groundTruth.getClassName(), confused.getClassName())
                    .add(confused.getConfidence(), confusedIou);
            } else {
                cell(cells, groundTruth.getClassName(), ConfusionCell.BACKGROUND).add(null, null);
            }
        }

        for (Detection prediction : remaining) {
            cell(cells, ConfusionCell.BACKGROUND, prediction.getClassName())
                .add(prediction.getConfidence(), null);
        }
        return cells;
    }

    private ConfusionCell cell(Map<String, ConfusionCell> cells, String actual, String predicted) {
        return cells.computeIfAbsent(actual + "->" + predicted, key -> new ConfusionCell(actual, predicted));
    }

    private int nonNegative(int count, String label) {
        if (count < 0) {
            log.warn("{} 计数为负，已截断为0: {}", label, count);
            return 0;
        }
        return count;
    }

    private static final class ScoredPrediction {
        private final int imageIndex;
        private final Detection detection;

        private ScoredPrediction(int imageIndex, Detection detection) {
            this.imageIndex = imageIndex;
            this.detection = detection;
        }
    }
}
