package org.boxfit.service.resize;

import org.boxfit.engine.RasterEngine;
import org.boxfit.model.Raster;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class Compositor {

    private final RasterEngine rasterEngine;

    /**
     * A foreground that already covers the whole box needs no backdrop at all.
     */
    public boolean isNeeded(Raster foreground, int boxWidth, int boxHeight) {
        return !foreground.hasSize(boxWidth, boxHeight);
    }

    public Raster composite(Raster canvas, Raster foreground, int offsetX, int offsetY) {
        return rasterEngine.composite(canvas, foreground, offsetX, offsetY);
    }
}
