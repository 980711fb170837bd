package buaa.detect.dto;

/**
 * 带类别的边界框（预测框与真实框的共同视图）
 */
public interface LabeledBox {

    BoundingBox getBbox();

    int getClassId();

    String getClassName();

    double getConfidence();
}
