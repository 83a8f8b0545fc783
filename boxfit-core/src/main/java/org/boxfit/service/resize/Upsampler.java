package org.boxfit.service.resize;

import org.boxfit.engine.RasterEngine;
import org.boxfit.model.Raster;
import org.boxfit.model.dto.Geometry;
import org.boxfit.model.enums.ResizeFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class Upsampler {

    private final RasterEngine rasterEngine;

    public boolean isNeeded(Raster raster, Geometry geometry, boolean upsize) {
        return upsize && (raster.getWidth() < geometry.targetWidth() || raster.getHeight() < geometry.targetHeight());
    }

    /**
     * One bicubic enlargement straight to the target size.
     */
    public Raster upsample(Raster raster, int targetWidth, int targetHeight, boolean bestfit) {
        log.debug("Upsampling {} to {}x{} (bestfit={})", raster, targetWidth, targetHeight, bestfit);
        return rasterEngine.resize(raster, targetWidth, targetHeight, ResizeFilter.CUBIC, 1.0, bestfit);
    }
}
