package buaa.detect.dto;

/**
 * 可用于模型显著性比较的指标
 */
public enum ComparisonMetric {
    PRECISION,
    RECALL,
    F1,
    MAP_50
}
