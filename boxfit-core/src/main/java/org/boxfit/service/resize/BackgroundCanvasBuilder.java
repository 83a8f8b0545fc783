package org.boxfit.service.resize;

import org.boxfit.engine.RasterEngine;
import org.boxfit.model.Raster;
import org.boxfit.model.dto.ResizeOptions;
import org.boxfit.model.enums.ResizeFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Produces the box-sized backdrop an image is centered on: a solid or transparent fill,
 * or a blurred copy of the source stretched over the whole box.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackgroundCanvasBuilder {

    private final RasterEngine rasterEngine;

    /**
     * @param source the upright source, not the scaled foreground
     */
    public Raster build(Raster source, ResizeOptions options, int boxWidth, int boxHeight) {
        if (options.useBlurredBackground()) {
            log.debug("Building blurred {}x{} backdrop (blur={})", boxWidth, boxHeight, options.getBlurValue());
            return rasterEngine.resize(source, boxWidth, boxHeight, ResizeFilter.CUBIC, options.getBlurValue(), false);
        }
        return rasterEngine.newCanvas(boxWidth, boxHeight, options.getColor());
    }
}
