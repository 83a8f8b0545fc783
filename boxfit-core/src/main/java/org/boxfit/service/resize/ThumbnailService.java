package org.boxfit.service.resize;

import org.boxfit.config.BoxfitProperties;
import org.boxfit.exception.BoxfitException;
import org.boxfit.model.Raster;
import org.boxfit.model.dto.BoxSpec;
import org.boxfit.model.dto.Geometry;
import org.boxfit.model.dto.ResizeOptions;
import org.boxfit.model.dto.ResizeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fits one source into any number of boxes, keeping its aspect ratio and filling the rest of
 * each box with a color, transparency or a blurred backdrop.
 * <p>
 * Boxes are processed widest first so the large halving steps land in the downsample cache
 * before the smaller boxes that can reuse them. The caller's source is never modified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThumbnailService {

    private static final Comparator<BoxSpec<?>> WIDEST_FIRST =
            Comparator.comparingInt((BoxSpec<?> box) -> box.width()).reversed();

    private final BoxfitProperties boxfitProperties;
    private final ResizeRequestValidator validator;
    private final OrientationNormalizer orientationNormalizer;
    private final BoxFitPlanner boxFitPlanner;
    private final ProgressiveDownsampler progressiveDownsampler;
    private final Upsampler upsampler;
    private final BackgroundCanvasBuilder backgroundCanvasBuilder;
    private final Compositor compositor;

    public Raster resize(Raster source, int boxWidth, int boxHeight) {
        return resize(source, boxWidth, boxHeight, defaultOptions());
    }

    public Raster resize(Raster source, int boxWidth, int boxHeight, ResizeOptions options) {
        return resizeMulti(source, List.of(BoxSpec.of(boxWidth, boxHeight, 0)), options).get(0);
    }

    public <K> Map<K, Raster> resizeMulti(Raster source, List<BoxSpec<K>> boxes) {
        return resizeMulti(source, boxes, defaultOptions());
    }

    /**
     * @return one raster per box, in the order the boxes were given
     * @throws BoxfitException with {@code INVALID_ARGUMENT} before any work if a box or option is bad,
     *                         or with the engine's kind if any box fails; no partial results are returned
     */
    public <K> Map<K, Raster> resizeMulti(Raster source, List<BoxSpec<K>> boxes, ResizeOptions options) {
        validator.validate(source, boxes, options);

        long start = System.nanoTime();
        List<BoxSpec<K>> ordered = new ArrayList<>(boxes);
        ordered.sort(WIDEST_FIRST);

        Map<K, Raster> resized = new HashMap<>();
        try (DownsampleCache cache = new DownsampleCache()) {
            Raster upright = orientationNormalizer.normalize(source);
            for (BoxSpec<K> box : ordered) {
                resized.put(box.key(), fitIntoBox(upright, box, options, cache));
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("Resized {} into {} box(es) in {} ms (cache hits={}, stored={}, entries={})",
                    source, boxes.size(), elapsedMs, cache.getHits(), cache.getStores(), cache.size());
        } catch (BoxfitException e) {
            log.error("Resizing {} failed: {}", source, e.getMessage(), e);
            resized.values().forEach(Raster::release);
            throw e;
        }

        Map<K, Raster> results = new LinkedHashMap<>();
        for (BoxSpec<K> box : boxes) {
            results.put(box.key(), resized.get(box.key()));
        }
        return results;
    }

    /**
     * Same as {@link #resizeMulti(Raster, List, ResizeOptions)} but reports failure as a value.
     */
    public <K> ResizeResult<K> tryResizeMulti(Raster source, List<BoxSpec<K>> boxes, ResizeOptions options) {
        try {
            return ResizeResult.success(resizeMulti(source, boxes, options));
        } catch (BoxfitException e) {
            return ResizeResult.failure(e);
        }
    }

    private <K> Raster fitIntoBox(Raster upright, BoxSpec<K> box, ResizeOptions options, DownsampleCache cache) {
        int boxWidth = box.width();
        int boxHeight = box.height();
        Geometry geometry = boxFitPlanner.plan(upright.getWidth(), upright.getHeight(), boxWidth, boxHeight, options.isUpsize());
        log.debug("Box {} for {}: target {}x{} at offset {},{}", box.sizeLabel(), upright,
                geometry.targetWidth(), geometry.targetHeight(), geometry.offsetX(), geometry.offsetY());

        Raster scaled = progressiveDownsampler.downsample(upright, geometry.targetWidth(), geometry.targetHeight(), cache);
        if (upsampler.isNeeded(scaled, geometry, options.isUpsize())) {
            scaled = upsampler.upsample(scaled, geometry.targetWidth(), geometry.targetHeight(), options.isBestfit());
        }

        if (!compositor.isNeeded(scaled, boxWidth, boxHeight)) {
            // results are owned by the caller alone, so never hand out the source or the shared upright copy
            return scaled == upright ? upright.copy() : scaled;
        }

        Raster canvas = backgroundCanvasBuilder.build(upright, options, boxWidth, boxHeight);
        return compositor.composite(canvas, scaled, geometry.offsetX(), geometry.offsetY());
    }

    private ResizeOptions defaultOptions() {
        return boxfitProperties.getResize().toOptions();
    }
}
