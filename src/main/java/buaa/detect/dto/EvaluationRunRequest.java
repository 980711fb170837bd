package buaa.detect.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 创建评测运行请求，未填写的参数使用配置中的默认值
 */
@Data
public class EvaluationRunRequest {

    @Size(max = 200)
    private String name;

    @Size(max = 2000)
    private String description;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double iouThreshold;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidenceThreshold;

    private List<String> models = new ArrayList<>();

    /** 物种过滤，为空表示全部物种 */
    private List<String> speciesFilter = new ArrayList<>();

    private LocalDateTime dateRangeStart;

    private LocalDateTime dateRangeEnd;

    /** K折折数，为空表示普通评测 */
    @Min(1)
    private Integer foldCount;

    private String device;

    /** 创建后是否立即启动 */
    private Boolean autoStart = Boolean.TRUE;
}
