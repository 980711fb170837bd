package buaa.detect.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 混淆矩阵单元格累计值
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ConfusionCell {

    /** 背景类（漏检或误检的另一侧） */
    public static final String BACKGROUND = "background";

    private final String actualClass;
    private final String predictedClass;
    private int count;
    private double confidenceSum;
    private int confidenceCount;
    private double iouSum;
    private int iouCount;

    public void add(Double confidence, Double iou) {
        count++;
        if (confidence != null) {
            confidenceSum += confidence;
            confidenceCount++;
        }
        if (iou != null) {
            iouSum += iou;
            iouCount++;
        }
    }

    public Double averageConfidence() {
        return confidenceCount == 0 ? null : confidenceSum / confidenceCount;
    }

    public Double averageIou() {
        return iouCount == 0 ? null : iouSum / iouCount;
    }
}
