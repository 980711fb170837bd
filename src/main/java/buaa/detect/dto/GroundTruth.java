package buaa.detect.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 经人工核验的真实标注框，置信度恒为 1.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GroundTruth implements LabeledBox {

    private final BoundingBox bbox;
    private final int classId;
    private final String className;

    public GroundTruth(BoundingBox bbox, int classId, String className) {
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        this.classId = classId;
        this.className = Objects.requireNonNull(className, "className");
    }

    @Override
    public double getConfidence() {
        return 1.0;
    }

    public GroundTruth withBox(BoundingBox box) {
        return new GroundTruth(box, classId, className);
    }

    public GroundTruth withClassName(String name) {
        return new GroundTruth(bbox, classId, name);
    }
}
