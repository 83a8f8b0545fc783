package org.boxfit.model;

import org.boxfit.model.enums.Orientation;
import lombok.Getter;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.WritableRaster;
import java.util.Objects;

/**
 * Handle to decoded pixel data plus its stored orientation tag.
 * <p>
 * Engine primitives never write into a raster they receive; they hand back a new one.
 * {@link #copy()} gives an independent deep copy for callers that need their own pixels.
 */
@Getter
public final class Raster {

    private final BufferedImage image;
    private final Orientation orientation;

    private Raster(BufferedImage image, Orientation orientation) {
        this.image = Objects.requireNonNull(image, "image");
        this.orientation = Objects.requireNonNull(orientation, "orientation");
    }

    public static Raster of(BufferedImage image) {
        return new Raster(image, Orientation.UNDEFINED);
    }

    public static Raster of(BufferedImage image, Orientation orientation) {
        return new Raster(image, orientation);
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    public boolean hasSize(int width, int height) {
        return getWidth() == width && getHeight() == height;
    }

    /**
     * Same pixels, different orientation tag. The pixel buffer is shared, which is safe
     * because nothing in this library writes into a raster it did not allocate itself.
     */
    public Raster withOrientation(Orientation newOrientation) {
        return new Raster(image, newOrientation);
    }

    public Raster copy() {
        ColorModel colorModel = image.getColorModel();
        WritableRaster data = image.copyData(image.getRaster().createCompatibleWritableRaster());
        BufferedImage clone = new BufferedImage(colorModel, data, colorModel.isAlphaPremultiplied(), null);
        return new Raster(clone, orientation);
    }

    /**
     * Releases the native resources behind the pixel buffer.
     */
    public void release() {
        image.flush();
    }

    @Override
    public String toString() {
        return "Raster[" + getWidth() + "x" + getHeight() + ", " + orientation + "]";
    }
}
