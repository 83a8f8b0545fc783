package org.boxfit.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Stored orientation tag of a raster, numbered as in the EXIF/TIFF orientation field.
 * Only the three pure rotations carry a correcting angle; mirrored variants are left alone.
 */
@RequiredArgsConstructor
@Getter
public enum Orientation {
    UNDEFINED(0, 0),
    TOP_LEFT(1, 0),
    TOP_RIGHT(2, 0),
    BOTTOM_RIGHT(3, 180),
    BOTTOM_LEFT(4, 0),
    LEFT_TOP(5, 0),
    RIGHT_TOP(6, 90),
    RIGHT_BOTTOM(7, 0),
    LEFT_BOTTOM(8, -90);

    private final int tag;
    private final int rotationDegrees;

    public boolean requiresRotation() {
        return rotationDegrees != 0;
    }

    public static Orientation fromTag(int tag) {
        return Arrays.stream(values())
                .filter(o -> o.tag == tag)
                .findFirst()
                .orElse(UNDEFINED);
    }
}
