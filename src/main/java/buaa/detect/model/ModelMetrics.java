package buaa.detect.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * 单个模型在一次评测中的性能指标
 * 普通评测每个模型一行；K折评测每个模型每折一行，外加一行汇总
 */
@Data
@Entity
@Immutable
@Table(name = "detection_model_metrics")
public class ModelMetrics {

    /** K折汇总行的模型名后缀 */
    public static final String KFOLD_AGGREGATE_SUFFIX = " [k-fold aggregate]";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "model_name", length = 100, nullable = false)
    private String modelName;

    @Enumerated(EnumType.STRING)
    @Column(name = "row_type", length = 20, nullable = false)
    private MetricsRowType rowType = MetricsRowType.OVERALL;

    @Column(name = "fold_index")
    private Integer foldIndex;

    @Column(name = "images_processed")
    private Integer imagesProcessed;

    @Column(name = "ground_truth_objects")
    private Integer groundTruthObjects;

    @Column(name = "predicted_objects")
    private Integer predictedObjects;

    @Column(name = "true_positives")
    private Integer truePositives;

    @Column(name = "false_positives")
    private Integer falsePositives;

    @Column(name = "false_negatives")
    private Integer falseNegatives;

    @Column(name = "precision_score")
    private Double precision;

    @Column(name = "recall_score")
    private Double recall;

    @Column(name = "f1_score")
    private Double f1Score;

    @Column(name = "map_50")
    private Double map50;

    @Column(name = "map_50_95")
    private Double map5095;

    // K折汇总行的标准差
    @Column(name = "precision_std")
    private Double precisionStd;

    @Column(name = "recall_std")
    private Double recallStd;

    @Column(name = "f1_std")
    private Double f1Std;

    @Column(name = "map_50_std")
    private Double map50Std;

    @Column(name = "avg_inference_time_ms")
    private Double avgInferenceTimeMs;

    @Column(name = "avg_confidence_score")
    private Double avgConfidenceScore;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    /**
     * 去掉K折汇总后缀后的模型名
     */
    public String baseModelName() {
        if (modelName != null && modelName.endsWith(KFOLD_AGGREGATE_SUFFIX)) {
            return modelName.substring(0, modelName.length() - KFOLD_AGGREGATE_SUFFIX.length());
        }
        return modelName;
    }
}
