package buaa.detect.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * 单个模型在单个物种上的指标，隶属于唯一一条 {@link ModelMetrics}
 */
@Data
@Entity
@Immutable
@Table(name = "detection_species_metrics")
public class SpeciesMetrics {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_metrics_id", nullable = false)
    private Long modelMetricsId;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "class_name", length = 100, nullable = false)
    private String className;

    @Column(name = "class_id")
    private Integer classId;

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

    /** AP@0.5，没有真实框时为空 */
    @Column(name = "average_precision")
    private Double averagePrecision;

    @Column(name = "avg_confidence")
    private Double avgConfidence;

    @Column(name = "ground_truth_count")
    private Integer groundTruthCount;

    @Column(name = "detected_count")
    private Integer detectedCount;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
