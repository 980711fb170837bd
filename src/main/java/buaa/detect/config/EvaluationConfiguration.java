package buaa.detect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 检测评测配置
 */
@Component
@ConfigurationProperties(prefix = "evaluation")
@Data
public class EvaluationConfiguration {

    private Defaults defaults = new Defaults();
    private Dataset dataset = new Dataset();
    private DetectorApi detector = new DetectorApi();
    private Executor executor = new Executor();

    /** PROCESSING 状态下进度超过该时长未更新即判定失败 */
    private Duration staleTimeout = Duration.ofMinutes(10);

    /** 僵死评测巡检间隔（毫秒） */
    private long staleCheckIntervalMs = 60_000;

    /** K折折数上限 */
    private int maxFoldCount = 20;

    /**
     * 评测参数默认值
     */
    @Data
    public static class Defaults {
        private double iouThreshold = 0.5;
        private double confidenceThreshold = 0.25;
        private List<String> models = new ArrayList<>(List.of("yolov5s", "yolov8l", "yolov9c"));
        private String device = "cpu";
    }

    /**
     * 本地数据集（YOLO 目录结构）
     */
    @Data
    public static class Dataset {
        private String imagesDir = "dataset/images";
        private String labelsDir = "dataset/labels";
        /** 类别ID到类别名的映射，下标即类别ID */
        private List<String> classNames = new ArrayList<>(
            List.of("chinese_egret", "whiskered_tern", "great_knot"));
        private List<String> imageExtensions = new ArrayList<>(List.of("jpg", "jpeg", "png"));
    }

    /**
     * 外部推理服务
     */
    @Data
    public static class DetectorApi {
        private String baseUrl = "http://localhost:8000";
        private String apiKey;
        /** 单张图像推理超时，超时记为该图像失败 */
        private Duration timeout = Duration.ofSeconds(30);
        private Duration loadTimeout = Duration.ofMinutes(2);
        private int maxRetries = 3;
    }

    /**
     * 评测线程池
     */
    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }
}
