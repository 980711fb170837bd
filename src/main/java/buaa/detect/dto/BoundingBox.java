package buaa.detect.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 边界框值对象
 *
 * <p>内部统一保存为左上/右下角点形式。由中心点形式（YOLO标注，归一化到[0,1]）
 * 构造的框会在构造时转换为角点形式，并保留 {@code normalized} 标记，
 * 几何运算前需要通过 {@link #toAbsolute(int, int)} 统一到像素坐标。</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BoundingBox {

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    /** 坐标是否为归一化坐标 */
    private final boolean normalized;

    private BoundingBox(double x1, double y1, double x2, double y2, boolean normalized) {
        requireFinite(x1, y1, x2, y2);
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException(
                String.format("边界框角点顺序错误: (%.4f, %.4f, %.4f, %.4f)", x1, y1, x2, y2));
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
        this.normalized = normalized;
    }

    /**
     * 由像素角点坐标构造
     */
    public static BoundingBox ofCorners(double x1, double y1, double x2, double y2) {
        return new BoundingBox(x1, y1, x2, y2, false);
    }

    /**
     * 由归一化中心点形式构造（cx, cy, w, h 均在 [0,1] 内）
     */
    public static BoundingBox ofCenter(double cx, double cy, double w, double h) {
        requireFinite(cx, cy, w, h);
        if (!inUnitRange(cx) || !inUnitRange(cy) || !inUnitRange(w) || !inUnitRange(h)) {
            throw new IllegalArgumentException(
                String.format("归一化坐标越界: (%.4f, %.4f, %.4f, %.4f)", cx, cy, w, h));
        }
        return new BoundingBox(cx - w / 2, cy - h / 2, cx + w / 2, cy + h / 2, true);
    }

    /**
     * 由像素左上角与宽高构造
     */
    public static BoundingBox ofPixelRect(double x, double y, double width, double height) {
        return ofCorners(x, y, x + width, y + height);
    }

    /**
     * 转换到像素坐标；已是像素坐标时原样返回。
     * 图像尺寸未知（非正数）时保持归一化坐标不变。
     */
    public BoundingBox toAbsolute(int imageWidth, int imageHeight) {
        if (!normalized || imageWidth <= 0 || imageHeight <= 0) {
            return this;
        }
        return new BoundingBox(x1 * imageWidth, y1 * imageHeight,
                               x2 * imageWidth, y2 * imageHeight, false);
    }

    public double getWidth() {
        return x2 - x1;
    }

    public double getHeight() {
        return y2 - y1;
    }

    public double area() {
        return getWidth() * getHeight();
    }

    public boolean isDegenerate() {
        return getWidth() <= 0 || getHeight() <= 0;
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static void requireFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("边界框坐标必须为有限数值");
            }
        }
    }
}
