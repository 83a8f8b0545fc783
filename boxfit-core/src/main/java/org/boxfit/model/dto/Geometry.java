package org.boxfit.model.dto;

/**
 * Where a scaled image lands inside its box: the scaled size plus the top-left offset.
 */
public record Geometry(int targetWidth, int targetHeight, int offsetX, int offsetY) {
}
