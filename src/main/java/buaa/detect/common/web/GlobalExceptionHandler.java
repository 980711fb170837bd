package buaa.detect.common.web;

import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.exception.AbstractException;
import buaa.detect.common.convention.exception.ClientException;
import buaa.detect.common.convention.result.Result;
import buaa.detect.common.convention.result.Results;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 统一捕获评测接口抛出的异常并转换为 {@link Result}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理参数校验异常（Bean Validation）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidationException(MethodArgumentNotValidException ex,
                                                                  HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null ? firstError.getDefaultMessage() : "参数校验失败";

        log.warn("[{}] {} - 参数校验失败: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                errorMessage);

        return ResponseEntity.badRequest()
                .body(Results.failure(EvalErrorCode.PARAM_INVALID.code(), errorMessage));
    }

    /**
     * 处理业务异常（ClientException / ServiceException）
     */
    @ExceptionHandler(AbstractException.class)
    public ResponseEntity<Result<Void>> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        if (ex.getCause() != null) {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode(),
                    ex);
        } else {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode());
        }

        HttpStatus status = ex instanceof ClientException
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(Results.failure(ex));
    }

    /**
     * 兜底处理
     */
    @ExceptionHandler(Throwable.class)
    public ResponseEntity<Result<Void>> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - 系统异常",
                request.getMethod(),
                getFullRequestUrl(request),
                throwable);

        // 不暴露内部异常细节
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Results.failure(EvalErrorCode.SERVICE_ERROR));
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() +
                (queryString != null ? "?" + queryString : "");
    }
}
