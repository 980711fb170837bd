package buaa.detect.common.convention.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.experimental.Accessors;

/**
 * 评测接口的统一响应体，由 {@link Results} 构造
 *
 * @param <T> 响应数据类型
 */
@Data
@Accessors(chain = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Result<T> {

    /** 成功返回码；失败时为 {@code EvalErrorCode} 中的 A/B/C 码 */
    public static final String SUCCESS_CODE = "0";

    private String code;

    private String message;

    /** 失败响应不带数据 */
    private T data;
}
