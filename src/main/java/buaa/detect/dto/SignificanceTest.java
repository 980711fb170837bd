package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 两独立样本 t 检验结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignificanceTest {

    private Double testStatistic;
    private Double twoSidedPValue;
    private boolean significant;
    /** |mean1 - mean2| / sqrt((var1 + var2) / 2) */
    private Double effectSize;
    private Integer degreesOfFreedom;
    private double alpha;
}
