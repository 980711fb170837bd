package buaa.detect.service;

import buaa.detect.dto.Detection;
import buaa.detect.dto.EvaluationImage;
import buaa.detect.dto.GroundTruth;
import cn.hutool.core.util.StrUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 预测框与真实框的规范化
 *
 * <p>统一坐标空间（像素角点坐标）与类别名称写法，并按物种过滤。</p>
 */
@Component
public class DetectionNormalizer {

    /**
     * 规范化类别名：去除首尾空白、转小写、空白与连字符替换为下划线。
     * "Chinese Egret" 与 "chinese_egret" 视为同一类别。
     */
    public static String canonicalClassName(String className) {
        if (StrUtil.isBlank(className)) {
            return "unknown";
        }
        return className.trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[\\s\\-]+", "_");
    }

    public List<Detection> normalizeDetections(List<Detection> detections,
                                               EvaluationImage image,
                                               Collection<String> speciesFilter) {
        Set<String> allowed = canonicalSet(speciesFilter);
        List<Detection> normalized = new ArrayList<>();
        if (detections == null) {
            return normalized;
        }
        for (Detection detection : detections) {
            String className = canonicalClassName(detection.getClassName());
            if (!allowed.isEmpty() && !allowed.contains(className)) {
                continue;
            }
            normalized.add(detection
                .withBox(detection.getBbox().toAbsolute(image.getWidth(), image.getHeight()))
                .withClassName(className));
        }
        return normalized;
    }

    public List<GroundTruth> normalizeGroundTruth(List<GroundTruth> groundTruths,
                                                  EvaluationImage image,
                                                  Collection<String> speciesFilter) {
        Set<String> allowed = canonicalSet(speciesFilter);
        List<GroundTruth> normalized = new ArrayList<>();
        if (groundTruths == null) {
            return normalized;
        }
        for (GroundTruth groundTruth : groundTruths) {
            String className = canonicalClassName(groundTruth.getClassName());
            if (!allowed.isEmpty() && !allowed.contains(className)) {
                continue;
            }
            normalized.add(groundTruth
                .withBox(groundTruth.getBbox().toAbsolute(image.getWidth(), image.getHeight()))
                .withClassName(className));
        }
        return normalized;
    }

    public Set<String> canonicalSet(Collection<String> classNames) {
        if (classNames == null || classNames.isEmpty()) {
            return Set.of();
        }
        return classNames.stream()
            .filter(StrUtil::isNotBlank)
            .map(DetectionNormalizer::canonicalClassName)
            .collect(Collectors.toSet());
    }
}
