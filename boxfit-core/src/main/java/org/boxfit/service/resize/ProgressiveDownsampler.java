package org.boxfit.service.resize;

import org.boxfit.engine.RasterEngine;
import org.boxfit.model.Raster;
import org.boxfit.model.enums.ResizeFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reduces a raster toward a target size by repeated halving (2x2 binning), which keeps far
 * more detail than a single large reduction.
 * <p>
 * The halving sequence only depends on the source size, so results of steps that halved both
 * dimensions exactly are shared through a {@link DownsampleCache} with later, smaller targets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressiveDownsampler {

    private final RasterEngine rasterEngine;

    /**
     * Returns {@code raster} itself when it is already no larger than the target.
     */
    public Raster downsample(Raster raster, int targetWidth, int targetHeight, DownsampleCache cache) {
        Raster current = raster;
        int width = raster.getWidth();
        int height = raster.getHeight();

        while (true) {
            boolean widthReduced = false;
            boolean widthIsHalf = false;
            if (width > targetWidth) {
                width /= 2;
                widthReduced = true;
                widthIsHalf = true;
                if (width < targetWidth) {
                    width = targetWidth;
                    widthIsHalf = false;
                }
            }

            boolean heightReduced = false;
            boolean heightIsHalf = false;
            if (height > targetHeight) {
                height /= 2;
                heightReduced = true;
                heightIsHalf = true;
                if (height < targetHeight) {
                    height = targetHeight;
                    heightIsHalf = false;
                }
            }

            if (!widthReduced && !heightReduced) {
                break;
            }

            var cached = cache.get(width, height);
            if (cached.isPresent()) {
                log.debug("Downsample cache hit for {}", DownsampleCache.key(width, height));
                current = cached.get();
                continue;
            }

            current = rasterEngine.resize(current, width, height, ResizeFilter.AREA);

            if (widthIsHalf && heightIsHalf) {
                cache.put(current);
            }
        }
        return current;
    }
}
