package buaa.detect.model;

import buaa.detect.dto.BoxSnapshot;
import buaa.detect.dto.MatchSnapshot;
import buaa.detect.model.converter.BoxSnapshotListConverter;
import buaa.detect.model.converter.MatchSnapshotListConverter;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 单张图像在单个模型上的评测明细
 */
@Data
@Entity
@Immutable
@Table(name = "detection_image_results")
public class ImageEvaluationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "model_name", length = 100, nullable = false)
    private String modelName;

    @Column(name = "fold_index")
    private Integer foldIndex;

    @Column(name = "image_filename", length = 255, nullable = false)
    private String imageFilename;

    @Convert(converter = BoxSnapshotListConverter.class)
    @Column(name = "ground_truth_boxes", length = 1_000_000)
    private List<BoxSnapshot> groundTruthBoxes = new ArrayList<>();

    @Column(name = "ground_truth_count")
    private Integer groundTruthCount;

    @Convert(converter = BoxSnapshotListConverter.class)
    @Column(name = "predicted_boxes", length = 1_000_000)
    private List<BoxSnapshot> predictedBoxes = new ArrayList<>();

    @Column(name = "predicted_count")
    private Integer predictedCount;

    @Convert(converter = MatchSnapshotListConverter.class)
    @Column(name = "matches", length = 1_000_000)
    private List<MatchSnapshot> matches = new ArrayList<>();

    @Convert(converter = BoxSnapshotListConverter.class)
    @Column(name = "unmatched_predictions", length = 1_000_000)
    private List<BoxSnapshot> unmatchedPredictions = new ArrayList<>();

    @Convert(converter = BoxSnapshotListConverter.class)
    @Column(name = "unmatched_ground_truth", length = 1_000_000)
    private List<BoxSnapshot> unmatchedGroundTruth = new ArrayList<>();

    @Column(name = "image_precision")
    private Double imagePrecision;

    @Column(name = "image_recall")
    private Double imageRecall;

    @Column(name = "image_f1")
    private Double imageF1;

    /** 已匹配框的平均IoU，无匹配时为空 */
    @Column(name = "avg_iou")
    private Double avgIou;

    @Column(name = "inference_time_ms")
    private Double inferenceTimeMs;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
