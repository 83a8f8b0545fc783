package org.boxfit.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ResizeOptions {

    public static final String DEFAULT_COLOR = "white";
    public static final String BLUR_COLOR = "blur";
    public static final int DEFAULT_MAX_WIDTH = 10000;
    public static final int DEFAULT_MAX_HEIGHT = 10000;
    public static final double DEFAULT_BLUR_VALUE = 15.0;

    /**
     * Background color name, hex value, "transparent", or "blur" for a blurred backdrop.
     */
    @Builder.Default
    String color = DEFAULT_COLOR;

    /**
     * Enlarge images smaller than the box instead of centering them at native size.
     */
    @Builder.Default
    boolean upsize = false;

    /**
     * Passed to the enlargement step to keep the result inside the target size.
     */
    @Builder.Default
    boolean bestfit = false;

    @Builder.Default
    int maxWidth = DEFAULT_MAX_WIDTH;

    @Builder.Default
    int maxHeight = DEFAULT_MAX_HEIGHT;

    @Builder.Default
    boolean blurBackground = false;

    @Builder.Default
    double blurValue = DEFAULT_BLUR_VALUE;

    public static ResizeOptions defaults() {
        return ResizeOptions.builder().build();
    }

    public boolean useBlurredBackground() {
        return blurBackground || BLUR_COLOR.equalsIgnoreCase(color);
    }
}
