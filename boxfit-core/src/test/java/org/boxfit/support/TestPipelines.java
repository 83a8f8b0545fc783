package org.boxfit.support;

import org.boxfit.config.BoxfitProperties;
import org.boxfit.engine.RasterEngine;
import org.boxfit.service.resize.BackgroundCanvasBuilder;
import org.boxfit.service.resize.BoxFitPlanner;
import org.boxfit.service.resize.Compositor;
import org.boxfit.service.resize.OrientationNormalizer;
import org.boxfit.service.resize.ProgressiveDownsampler;
import org.boxfit.service.resize.ResizeRequestValidator;
import org.boxfit.service.resize.ThumbnailService;
import org.boxfit.service.resize.Upsampler;

public final class TestPipelines {

    private TestPipelines() {
    }

    public static ThumbnailService thumbnailService(RasterEngine engine) {
        return thumbnailService(engine, new BoxfitProperties());
    }

    public static ThumbnailService thumbnailService(RasterEngine engine, BoxfitProperties properties) {
        return new ThumbnailService(
                properties,
                new ResizeRequestValidator(),
                new OrientationNormalizer(engine),
                new BoxFitPlanner(),
                new ProgressiveDownsampler(engine),
                new Upsampler(engine),
                new BackgroundCanvasBuilder(engine),
                new Compositor(engine));
    }
}
