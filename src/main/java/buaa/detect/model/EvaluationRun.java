package buaa.detect.model;

import buaa.detect.model.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 评测运行记录
 * 由发起评测的请求创建，在进入终态前只由评测编排器修改
 */
@Data
@Entity
@Table(name = "detection_evaluation_runs")
public class EvaluationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 200, nullable = false)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    // ==================== 评测参数 ====================

    @Column(name = "iou_threshold", nullable = false)
    private Double iouThreshold;

    @Column(name = "confidence_threshold", nullable = false)
    private Double confidenceThreshold;

    @Convert(converter = StringListConverter.class)
    @Column(name = "models_evaluated", length = 4000)
    private List<String> modelsEvaluated = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "species_filter", length = 4000)
    private List<String> speciesFilter = new ArrayList<>();

    @Column(name = "date_range_start")
    private LocalDateTime dateRangeStart;

    @Column(name = "date_range_end")
    private LocalDateTime dateRangeEnd;

    /** K折评测的折数，为空表示普通评测 */
    @Column(name = "fold_count")
    private Integer foldCount;

    @Column(name = "device", length = 32)
    private String device;

    // ==================== 状态 ====================

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    // ==================== 汇总指标（完成前为空） ====================

    @Column(name = "overall_precision")
    private Double overallPrecision;

    @Column(name = "overall_recall")
    private Double overallRecall;

    @Column(name = "overall_f1_score")
    private Double overallF1Score;

    @Column(name = "overall_map_50")
    private Double overallMap50;

    @Column(name = "overall_map_50_95")
    private Double overallMap5095;

    @Column(name = "total_images_evaluated")
    private Integer totalImagesEvaluated = 0;

    @Column(name = "total_ground_truth_objects")
    private Integer totalGroundTruthObjects = 0;

    @Column(name = "total_predicted_objects")
    private Integer totalPredictedObjects = 0;

    @Column(name = "skipped_images")
    private Integer skippedImages = 0;

    // ==================== 时间 ====================

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    /** 乐观锁版本；编排器与超时回收并发写终态时后写者失败 */
    @Version
    @Column(name = "version")
    private Long version;

    /**
     * 状态迁移，只允许单向前进，终态不可再变更
     *
     * @throws IllegalStateException 迁移不合法时
     */
    public void transitionTo(RunStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("评测运行 %d 状态不能从 %s 变更为 %s", id, status, target));
        }
        this.status = target;
    }

    public boolean isKFold() {
        return foldCount != null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
