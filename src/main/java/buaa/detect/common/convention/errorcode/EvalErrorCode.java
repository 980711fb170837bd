package buaa.detect.common.convention.errorcode;

/**
 * 评测业务错误码枚举
 *
 * 错误码规范：
 * - 0: 成功
 * - A0xxx: 客户端错误（参数校验、重复操作等）
 * - B0xxx: 服务端错误（评测流程、数据库等）
 * - C0xxx: 外部依赖错误（推理服务、标注数据）
 */
public enum EvalErrorCode implements IErrorCode {

    // ==================== 通用错误 ====================
    /**
     * 操作成功
     */
    SUCCESS("0", "操作成功"),

    /**
     * 客户端请求错误
     */
    CLIENT_ERROR("A0001", "客户端请求错误"),

    /**
     * 服务端执行错误
     */
    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 参数校验错误 (A01xx) ====================
    /**
     * 必填参数为空
     */
    PARAM_EMPTY("A0101", "必填参数为空"),

    /**
     * 参数格式错误
     */
    PARAM_INVALID("A0102", "参数格式错误"),

    /**
     * IoU阈值必须在0-1之间
     */
    IOU_THRESHOLD_INVALID("A0103", "IoU阈值必须在0-1之间"),

    /**
     * 置信度阈值必须在0-1之间
     */
    CONFIDENCE_THRESHOLD_INVALID("A0104", "置信度阈值必须在0-1之间"),

    /**
     * 折数必须为正整数
     */
    FOLD_COUNT_INVALID("A0105", "折数超出允许范围"),

    /**
     * 日期范围不合法
     */
    DATE_RANGE_INVALID("A0106", "开始日期不能晚于结束日期"),

    /**
     * 未指定待评测模型
     */
    MODELS_EMPTY("A0107", "未指定待评测模型"),

    /**
     * 显著性水平必须在0-1之间
     */
    ALPHA_INVALID("A0108", "显著性水平必须在0-1之间"),

    /**
     * 不支持的评测指标
     */
    METRIC_NOT_SUPPORTED("A0109", "不支持的评测指标"),

    // ==================== 评测运行状态错误 (A04xx) ====================
    /**
     * 评测运行不存在
     */
    RUN_NOT_FOUND("A0401", "评测运行不存在"),

    /**
     * 评测已启动或已结束
     */
    RUN_ALREADY_STARTED("A0402", "评测已启动或已结束"),

    /**
     * 评测正在进行中
     */
    RUN_IN_PROGRESS("A0403", "评测正在进行中"),

    /**
     * 非K折评测无法进行显著性检验
     */
    RUN_NOT_KFOLD("A0404", "仅K折评测支持模型显著性比较"),

    // ==================== 服务端错误 (B0xxx) ====================
    /**
     * 没有可评测的图像
     */
    NO_EVALUABLE_IMAGES("B0101", "没有可用于评测的图像（缺少图像或真实标注）"),

    /**
     * 评测执行失败
     */
    EVALUATION_FAILED("B0102", "评测执行失败"),

    /**
     * 评测已取消
     */
    EVALUATION_CANCELLED("B0103", "评测已取消"),

    /**
     * 评测进度长时间未更新
     */
    EVALUATION_STALLED("B0104", "评测进度长时间未更新，已判定为失败"),

    /**
     * 数据库操作异常
     */
    DATABASE_ERROR("B0105", "数据库操作异常"),

    // ==================== 外部依赖错误 (C0xxx) ====================
    /**
     * 模型加载失败
     */
    MODEL_LOAD_FAILED("C0101", "模型加载失败"),

    /**
     * 推理服务异常
     */
    DETECTOR_ERROR("C0102", "推理服务异常"),

    /**
     * 标注文件格式错误
     */
    ANNOTATION_INVALID("C0103", "标注文件格式错误");

    private final String code;
    private final String message;

    EvalErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
