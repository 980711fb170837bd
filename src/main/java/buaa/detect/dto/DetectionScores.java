package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 混淆计数及由其导出的精确率、召回率与F1
 */
@Getter
@ToString
@AllArgsConstructor
public final class DetectionScores {

    private final int truePositives;
    private final int falsePositives;
    private final int falseNegatives;
    private final double precision;
    private final double recall;
    private final double f1Score;
}
