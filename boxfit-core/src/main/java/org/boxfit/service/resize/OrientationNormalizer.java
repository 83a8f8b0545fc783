package org.boxfit.service.resize;

import org.boxfit.engine.RasterEngine;
import org.boxfit.model.Raster;
import org.boxfit.model.enums.Orientation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.Color;

/**
 * Turns a raster upright according to its orientation tag so box geometry can ignore it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrientationNormalizer {

    private static final Color ROTATION_FILL = Color.WHITE;

    private final RasterEngine rasterEngine;

    /**
     * Returns {@code raster} itself when no rotation is needed, otherwise a rotated raster
     * whose orientation tag has been cleared.
     */
    public Raster normalize(Raster raster) {
        Orientation orientation = raster.getOrientation();
        if (!orientation.requiresRotation()) {
            return raster;
        }
        log.debug("Rotating {} by {} degrees for orientation {}", raster, orientation.getRotationDegrees(), orientation);
        return rasterEngine.rotate(raster, orientation.getRotationDegrees(), ROTATION_FILL);
    }
}
