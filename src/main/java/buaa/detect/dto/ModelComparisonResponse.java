package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * K折评测的模型间统计比较
 */
@Data
@NoArgsConstructor
public class ModelComparisonResponse {

    private Long runId;
    private ComparisonMetric metric;
    private Double alpha;
    private List<ModelSample> models = new ArrayList<>();
    private List<PairwiseComparison> comparisons = new ArrayList<>();

    /**
     * 单个模型在各折上的指标样本
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelSample {
        private String modelName;
        private List<Double> foldValues;
        private SampleSummary summary;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PairwiseComparison {
        private String firstModel;
        private String secondModel;
        private SignificanceTest test;
    }
}
