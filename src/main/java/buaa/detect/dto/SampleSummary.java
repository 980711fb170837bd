package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 指标样本统计摘要
 * 样本数小于2时置信区间与标准误为空
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SampleSummary {

    private int sampleSize;
    private Double mean;
    private Double standardDeviation;
    private Double standardError;
    private Double confidenceLevel;
    private Double ciLower;
    private Double ciUpper;
}
