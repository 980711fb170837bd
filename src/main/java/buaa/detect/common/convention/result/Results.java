package buaa.detect.common.convention.result;

import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.errorcode.IErrorCode;
import buaa.detect.common.convention.exception.AbstractException;

import java.util.Optional;

/**
 * 返回对象构造工具类
 */
public final class Results {

    private static final String SUCCESS_MESSAGE = "操作成功";

    private Results() {
    }

    /**
     * 构造成功响应（无数据）
     */
    public static Result<Void> success() {
        return new Result<Void>()
                .setCode(Result.SUCCESS_CODE)
                .setMessage(SUCCESS_MESSAGE);
    }

    /**
     * 构造成功响应（带数据）
     *
     * @param data 响应数据
     * @param <T> 数据类型
     */
    public static <T> Result<T> success(T data) {
        return new Result<T>()
                .setCode(Result.SUCCESS_CODE)
                .setMessage(SUCCESS_MESSAGE)
                .setData(data);
    }

    /**
     * 构造失败响应（从业务异常）
     *
     * @param exception 业务异常
     */
    public static Result<Void> failure(AbstractException exception) {
        return new Result<Void>()
                .setCode(Optional.ofNullable(exception.getErrorCode())
                        .orElse(EvalErrorCode.SERVICE_ERROR.code()))
                .setMessage(Optional.ofNullable(exception.getErrorMessage())
                        .orElse(EvalErrorCode.SERVICE_ERROR.message()));
    }

    /**
     * 构造失败响应（使用错误码和自定义消息）
     */
    public static Result<Void> failure(String errorCode, String errorMessage) {
        return new Result<Void>()
                .setCode(errorCode)
                .setMessage(errorMessage);
    }

    /**
     * 构造失败响应（使用错误码枚举）
     */
    public static Result<Void> failure(IErrorCode errorCode) {
        return new Result<Void>()
                .setCode(errorCode.code())
                .setMessage(errorCode.message());
    }
}
