package buaa.detect.service;

import buaa.detect.dto.BoundingBox;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BoxGeometryTest {

    @Test
    void iouIsSymmetric() {
        BoundingBox a = BoundingBox.ofCorners(0, 0, 10, 10);
        BoundingBox b = BoundingBox.ofCorners(5, 5, 15, 15);

        assertThat(BoxGeometry.iou(a, b)).isEqualTo(BoxGeometry.iou(b, a));
        // 交集 25，并集 175
        assertThat(BoxGeometry.iou(a, b)).isCloseTo(25.0 / 175.0, within(1e-9));
    }

    @Test
    void selfIouIsOne() {
        BoundingBox box = BoundingBox.ofPixelRect(3, 4, 20, 30);
        assertThat(BoxGeometry.iou(box, box)).isEqualTo(1.0);
    }

    @Test
    void disjointAndTouchingBoxesHaveZeroIou() {
        BoundingBox a = BoundingBox.ofCorners(0, 0, 10, 10);
        assertThat(BoxGeometry.iou(a, BoundingBox.ofCorners(20, 20, 30, 30))).isZero();
        assertThat(BoxGeometry.iou(a, BoundingBox.ofCorners(10, 0, 20, 10))).isZero();
    }

    @Test
    void degenerateBoxHasZeroIou() {
        BoundingBox line = BoundingBox.ofCorners(0, 0, 0, 10);
        assertThat(BoxGeometry.iou(line, BoundingBox.ofCorners(0, 0, 10, 10))).isZero();
    }

    @Test
    void centerFormConvertsToSameBoxAsCorners() {
        BoundingBox center = BoundingBox.ofCenter(0.5, 0.5, 0.5, 0.5).toAbsolute(200, 100);
        BoundingBox corners = BoundingBox.ofCorners(50, 25, 150, 75);

        assertThat(BoxGeometry.iou(center, corners)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void mixedCoordinateSpacesAreRejected() {
        BoundingBox normalized = BoundingBox.ofCenter(0.5, 0.5, 0.2, 0.2);
        BoundingBox absolute = BoundingBox.ofCorners(0, 0, 10, 10);

        assertThatThrownBy(() -> BoxGeometry.iou(normalized, absolute))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
