package buaa.detect.service;

import buaa.detect.dto.Detection;
import buaa.detect.dto.GroundTruth;
import buaa.detect.dto.Match;
import buaa.detect.dto.MatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 预测框与真实框的贪心匹配
 *
 * <p>预测框按置信度从高到低处理（置信度相同保持原始顺序）。每个预测框在尚未被占用的
 * 同类真实框中选择 IoU 最大者，IoU 不低于阈值时才建立匹配。单遍、不回溯：
 * 先处理的高置信度预测占用的真实框不会被后续预测抢走，跨类别永不匹配。</p>
 */
@Component
public class DetectionMatcher {

    public MatchResult match(List<Detection> predictions,
                             List<GroundTruth> groundTruths,
                             double iouThreshold) {
        List<Detection> ordered = new ArrayList<>(predictions);
        // List.sort 为稳定排序
        ordered.sort(Comparator.comparingDouble(Detection::getConfidence).reversed());

        boolean[] claimed = new boolean[groundTruths.size()];
        List<Match> matches = new ArrayList<>();
        List<Detection> unmatchedPredictions = new ArrayList<>();

        for (Detection prediction : ordered) {
            int bestIndex = -1;
            double bestIou = 0.0;
            for (int i = 0; i < groundTruths.size(); i++) {
                if (claimed[i]) {
                    continue;
                }
                GroundTruth groundTruth = groundTruths.get(i);
                if (!prediction.getClassName().equals(groundTruth.getClassName())) {
                    continue;
                }
                double iou = BoxGeometry.iou(prediction.getBbox(), groundTruth.getBbox());
                if (bestIndex < 0 || iou > bestIou) {
                    bestIou = iou;
                    bestIndex = i;
                }
            }

            if (bestIndex >= 0 && bestIou >= iouThreshold && bestIou > 0.0) {
                claimed[bestIndex] = true;
                matches.add(new Match(prediction, groundTruths.get(bestIndex), bestIou));
            } else {
                unmatchedPredictions.add(prediction);
            }
        }

        List<GroundTruth> unmatchedGroundTruth = new ArrayList<>();
        for (int i = 0; i < groundTruths.size(); i++) {
            if (!claimed[i]) {
                unmatchedGroundTruth.add(groundTruths.get(i));
            }
        }
        return new MatchResult(matches, unmatchedPredictions, unmatchedGroundTruth);
    }
}
