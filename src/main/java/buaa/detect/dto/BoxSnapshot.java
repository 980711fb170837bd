package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 持久化用的边界框快照，bbox 为像素角点坐标 [x1, y1, x2, y2]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoxSnapshot {

    private List<Double> bbox;
    private Double confidence;
    private Integer classId;
    private String className;

    public static BoxSnapshot of(LabeledBox box) {
        BoundingBox b = box.getBbox();
        return new BoxSnapshot(
            List.of(b.getX1(), b.getY1(), b.getX2(), b.getY2()),
            box.getConfidence(),
            box.getClassId(),
            box.getClassName()
        );
    }
}
