package org.boxfit.service.resize;

import org.boxfit.exception.BoxfitError;
import org.boxfit.model.Raster;
import org.boxfit.model.dto.BoxSpec;
import org.boxfit.model.dto.ResizeOptions;
import org.boxfit.util.ColorUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Checks a whole request before any pixel work starts, so a bad box late in a batch
 * cannot leave earlier boxes half processed.
 */
@Component
public class ResizeRequestValidator {

    public void validate(Raster source, Collection<? extends BoxSpec<?>> boxes, ResizeOptions options) {
        if (source == null) {
            throw BoxfitError.NULL_SOURCE.createException();
        }
        validateOptions(options);

        Set<Object> keys = new HashSet<>();
        for (BoxSpec<?> box : boxes) {
            if (box == null) {
                throw BoxfitError.NULL_BOX_SPEC.createException();
            }
            if (box.width() <= 0 || box.width() > options.getMaxWidth()) {
                throw BoxfitError.INVALID_BOX_WIDTH.createException(box.width(), options.getMaxWidth());
            }
            if (box.height() <= 0 || box.height() > options.getMaxHeight()) {
                throw BoxfitError.INVALID_BOX_HEIGHT.createException(box.height(), options.getMaxHeight());
            }
            if (!keys.add(box.key())) {
                throw BoxfitError.DUPLICATE_BOX_KEY.createException(box.key());
            }
        }
    }

    public void validateOptions(ResizeOptions options) {
        String color = options.getColor();
        if (StringUtils.isBlank(color)) {
            throw BoxfitError.INVALID_COLOR.createException(color);
        }
        if (!options.useBlurredBackground() && ColorUtils.parse(color).isEmpty()) {
            throw BoxfitError.INVALID_COLOR.createException(color);
        }
        if (options.getMaxWidth() <= 0) {
            throw BoxfitError.INVALID_MAX_WIDTH.createException(options.getMaxWidth());
        }
        if (options.getMaxHeight() <= 0) {
            throw BoxfitError.INVALID_MAX_HEIGHT.createException(options.getMaxHeight());
        }
        double blurValue = options.getBlurValue();
        if (!Double.isFinite(blurValue) || blurValue <= 0) {
            throw BoxfitError.INVALID_BLUR_VALUE.createException(blurValue);
        }
    }
}
