package buaa.detect.service;

import buaa.detect.dto.BoundingBox;
import lombok.extern.slf4j.Slf4j;

/**
 * 边界框几何计算工具类
 */
@Slf4j
public final class BoxGeometry {

    private BoxGeometry() {
    }

    /**
     * 计算两个边界框的交并比（IoU）
     *
     * <p>两框需处于同一坐标空间（同为像素坐标或同为归一化坐标）。
     * 不相交或任一框面积非正时返回 0。</p>
     *
     * @return [0,1] 范围内的 IoU
     */
    public static double iou(BoundingBox a, BoundingBox b) {
        if (a.isNormalized() != b.isNormalized()) {
            throw new IllegalArgumentException("边界框坐标空间不一致，需先统一为像素坐标");
        }
        if (a.isDegenerate() || b.isDegenerate()) {
            return 0.0;
        }

        double ix1 = Math.max(a.getX1(), b.getX1());
        double iy1 = Math.max(a.getY1(), b.getY1());
        double ix2 = Math.min(a.getX2(), b.getX2());
        double iy2 = Math.min(a.getY2(), b.getY2());
        if (ix2 <= ix1 || iy2 <= iy1) {
            return 0.0;
        }

        double intersection = (ix2 - ix1) * (iy2 - iy1);
        double union = a.area() + b.area() - intersection;
        if (union <= 0) {
            return 0.0;
        }
        return clamp(intersection / union);
    }

    private static double clamp(double iou) {
        if (iou < 0.0 || iou > 1.0 || Double.isNaN(iou)) {
            log.warn("IoU超出[0,1]范围，已截断: {}", iou);
            return Double.isNaN(iou) ? 0.0 : Math.max(0.0, Math.min(1.0, iou));
        }
        return iou;
    }
}
