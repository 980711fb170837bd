package buaa.detect.client;

import buaa.detect.dto.EvaluationImage;
import buaa.detect.dto.GroundTruth;

import java.util.List;

/**
 * 真实标注来源
 */
public interface GroundTruthStore {

    /**
     * 读取图像的真实标注，没有标注时返回空列表
     */
    List<GroundTruth> load(EvaluationImage image);
}
