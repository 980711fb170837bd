package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * 待评测图像描述
 */
@Getter
@ToString
@AllArgsConstructor
public final class EvaluationImage {

    /** 图像文件名，作为折划分与结果记录的标识 */
    private final String filename;

    private final Path path;

    private final LocalDateTime uploadedAt;

    /** 图像宽度（像素），未知时为0 */
    private final int width;

    /** 图像高度（像素），未知时为0 */
    private final int height;
}
