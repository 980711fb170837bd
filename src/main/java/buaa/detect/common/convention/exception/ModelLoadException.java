package buaa.detect.common.convention.exception;

import buaa.detect.common.convention.errorcode.EvalErrorCode;

import lombok.Getter;

/**
 * 模型加载异常
 * 某个待评测模型无法加载时抛出，会终止整个评测运行
 */
@Getter
public class ModelLoadException extends ServiceException {

    /** 加载失败的模型标识 */
    private final String modelId;

    public ModelLoadException(String modelId, String message) {
        this(modelId, message, null);
    }

    public ModelLoadException(String modelId, String message, Throwable cause) {
        super(String.format("模型 %s 加载失败: %s", modelId, message), cause, EvalErrorCode.MODEL_LOAD_FAILED);
        this.modelId = modelId;
    }
}
