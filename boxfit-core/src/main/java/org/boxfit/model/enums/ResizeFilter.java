package org.boxfit.model.enums;

public enum ResizeFilter {
    /**
     * Area averaging (box). Used for every halving step.
     */
    AREA,
    /**
     * Bicubic interpolation. Used for enlargement and blurred backdrops.
     */
    CUBIC
}
