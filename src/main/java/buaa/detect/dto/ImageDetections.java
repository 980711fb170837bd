package buaa.detect.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 单张图像上某个模型的（已规范化）预测框与真实框，用于跨图像计算AP
 */
@Getter
@ToString
public final class ImageDetections {

    private final String filename;
    private final List<Detection> predictions;
    private final List<GroundTruth> groundTruths;

    public ImageDetections(String filename, List<Detection> predictions, List<GroundTruth> groundTruths) {
        this.filename = filename;
        this.predictions = List.copyOf(predictions);
        this.groundTruths = List.copyOf(groundTruths);
    }
}
