package buaa.detect.model;

/**
 * 模型指标行类型
 */
public enum MetricsRowType {
    /** 普通评测的模型汇总 */
    OVERALL,
    /** K折评测中的单折 */
    FOLD,
    /** K折评测中各折的均值与标准差 */
    KFOLD_AGGREGATE
}
