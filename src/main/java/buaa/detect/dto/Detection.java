package buaa.detect.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 检测器输出的单个预测框
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Detection implements LabeledBox {

    private final BoundingBox bbox;
    private final double confidence;
    private final int classId;
    private final String className;

    public Detection(BoundingBox bbox, double confidence, int classId, String className) {
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("置信度必须在[0,1]之间: " + confidence);
        }
        this.confidence = confidence;
        this.classId = classId;
        this.className = Objects.requireNonNull(className, "className");
    }

    public Detection withBox(BoundingBox box) {
        return new Detection(box, confidence, classId, className);
    }

    public Detection withClassName(String name) {
        return new Detection(bbox, confidence, classId, name);
    }
}
