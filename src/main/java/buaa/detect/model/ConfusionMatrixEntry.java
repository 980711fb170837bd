package buaa.detect.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * 混淆矩阵条目（真实类别 -> 预测类别），background 表示漏检或误检
 */
@Data
@Entity
@Immutable
@Table(name = "detection_confusion_entries")
public class ConfusionMatrixEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "model_name", length = 100, nullable = false)
    private String modelName;

    @Column(name = "actual_class", length = 100, nullable = false)
    private String actualClass;

    @Column(name = "predicted_class", length = 100, nullable = false)
    private String predictedClass;

    @Column(name = "entry_count")
    private Integer count;

    /** 占该模型全部条目的百分比 */
    @Column(name = "percentage")
    private Double percentage;

    @Column(name = "avg_confidence")
    private Double avgConfidence;

    @Column(name = "avg_iou")
    private Double avgIou;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
