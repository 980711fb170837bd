package buaa.detect.client;

import buaa.detect.common.convention.exception.ModelLoadException;
import buaa.detect.dto.Detection;
import buaa.detect.dto.EvaluationImage;

import java.util.List;

/**
 * 目标检测器边界
 * 推理本身由外部服务完成，这里只约定加载模型与单图推理
 */
public interface Detector {

    /**
     * 加载模型
     *
     * @throws ModelLoadException 模型无法加载
     */
    DetectorModel loadModel(String modelId, String device);

    /**
     * 对单张图像推理，返回已按置信度阈值过滤的检测结果
     */
    List<Detection> detect(DetectorModel model, EvaluationImage image, double confidenceThreshold);

    /**
     * 卸载模型，释放推理端资源
     */
    default void unloadModel(DetectorModel model) {
    }
}
