package buaa.detect.client;

import buaa.detect.dto.EvaluationImage;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 待评测图像来源
 */
public interface ImageCatalog {

    /**
     * 查询上传时间在 [from, to] 内的图像，边界为空表示不限
     */
    List<EvaluationImage> findImages(LocalDateTime from, LocalDateTime to);
}
