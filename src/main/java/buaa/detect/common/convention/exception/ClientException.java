package buaa.detect.common.convention.exception;

import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * 客户端异常
 * 用于表示由客户端请求引起的错误（如阈值越界、重复启动评测等）
 * HTTP状态码通常为 4xx
 */
public class ClientException extends AbstractException {

    /**
     * 使用错误码构造异常
     */
    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    /**
     * 使用自定义消息构造异常（使用默认客户端错误码）
     */
    public ClientException(String message) {
        this(message, null, EvalErrorCode.CLIENT_ERROR);
    }

    /**
     * 使用自定义消息和错误码构造异常
     */
    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * 完整构造器
     *
     * @param message 自定义错误消息
     * @param throwable 原始异常
     * @param errorCode 错误码
     */
    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
