package buaa.detect.client;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 已加载的检测模型句柄
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class DetectorModel {

    private final String modelId;
    private final String device;
    /** 推理服务返回的模型句柄 */
    private final String handle;
}
