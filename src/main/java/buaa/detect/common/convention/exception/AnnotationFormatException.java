package buaa.detect.common.convention.exception;

import buaa.detect.common.convention.errorcode.EvalErrorCode;

/**
 * 标注格式异常
 * 单张图像的真实标注无法解析，仅影响该图像
 */
public class AnnotationFormatException extends ServiceException {

    public AnnotationFormatException(String message) {
        super(message, null, EvalErrorCode.ANNOTATION_INVALID);
    }

    public AnnotationFormatException(String message, Throwable cause) {
        super(message, cause, EvalErrorCode.ANNOTATION_INVALID);
    }
}
