package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一对匹配成功的预测框与真实框
 */
@Getter
@ToString
@AllArgsConstructor
public final class Match {

    private final Detection prediction;
    private final GroundTruth groundTruth;
    private final double iou;
}
