package org.boxfit.engine;

import org.boxfit.exception.BoxfitError;
import org.boxfit.exception.BoxfitException;
import org.boxfit.model.Raster;
import org.boxfit.model.enums.Orientation;
import org.boxfit.model.enums.ResizeFilter;
import org.boxfit.util.ColorUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * {@link RasterEngine} on top of Java2D and ImageIO.
 */
@Slf4j
@Component
public class Java2dRasterEngine implements RasterEngine {

    private static final Set<String> OPAQUE_FORMATS = Set.of("jpeg", "jpg", "bmp", "wbmp");

    @Override
    public Raster decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw BoxfitError.DECODE_FAILED.createException("no data");
        }
        try (InputStream in = new ByteArrayInputStream(data)) {
            return read(in, data.length + " bytes");
        } catch (IOException e) {
            throw BoxfitError.DECODE_FAILED.createException(e, e.getMessage());
        }
    }

    @Override
    public Raster decode(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw BoxfitError.IMAGE_NOT_FOUND.createException(path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw BoxfitError.DECODE_FAILED.createException(e, path);
        }
    }

    @Override
    public Raster rotate(Raster raster, double degrees, Color fill) {
        try {
            double normalized = ((degrees % 360) + 360) % 360;
            BufferedImage source = raster.getImage();
            BufferedImage rotated;
            if (normalized == 0) {
                rotated = raster.copy().getImage();
            } else if (normalized == 90 || normalized == 180 || normalized == 270) {
                rotated = rotateQuadrant(source, (int) normalized);
            } else {
                rotated = rotateFree(source, normalized, fill);
            }
            return Raster.of(rotated, Orientation.UNDEFINED);
        } catch (RuntimeException e) {
            throw BoxfitError.ROTATE_FAILED.createException(e, degrees, e.getMessage());
        }
    }

    @Override
    public Raster resize(Raster raster, int width, int height, ResizeFilter filter, double blur, boolean bestfit) {
        try {
            BufferedImage source = raster.getImage();
            int targetWidth = width;
            int targetHeight = height;
            if (bestfit) {
                double scale = Math.min((double) width / source.getWidth(), (double) height / source.getHeight());
                targetWidth = Math.max(1, (int) Math.round(source.getWidth() * scale));
                targetHeight = Math.max(1, (int) Math.round(source.getHeight() * scale));
            }

            BufferedImage resized = switch (filter) {
                case AREA -> AreaAveragingResampler.resample(source, targetWidth, targetHeight);
                case CUBIC -> blur > 1.0
                        ? softened(source, targetWidth, targetHeight, blur)
                        : bicubic(source, targetWidth, targetHeight);
            };
            return Raster.of(resized, raster.getOrientation());
        } catch (RuntimeException e) {
            throw BoxfitError.RESIZE_FAILED.createException(e, width, height, e.getMessage());
        }
    }

    @Override
    public Raster newCanvas(int width, int height, String color) {
        Color fill = ColorUtils.parse(color)
                .orElseThrow(() -> BoxfitError.INVALID_COLOR.createException(color));
        BufferedImage canvas;
        try {
            canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        } catch (RuntimeException | OutOfMemoryError e) {
            throw BoxfitError.CANVAS_ALLOCATION_FAILED.createException(e, width, height, e.getMessage());
        }
        if (!ColorUtils.isTransparent(fill)) {
            Graphics2D g = canvas.createGraphics();
            try {
                g.setComposite(AlphaComposite.Src);
                g.setColor(fill);
                g.fillRect(0, 0, width, height);
            } finally {
                g.dispose();
            }
        }
        return Raster.of(canvas);
    }

    @Override
    public Raster composite(Raster canvas, Raster foreground, int offsetX, int offsetY) {
        try {
            BufferedImage result = canvas.copy().getImage();
            Graphics2D g = result.createGraphics();
            try {
                g.setComposite(AlphaComposite.SrcOver);
                g.drawImage(foreground.getImage(), offsetX, offsetY, null);
            } finally {
                g.dispose();
            }
            return Raster.of(result);
        } catch (RuntimeException e) {
            throw BoxfitError.COMPOSITE_FAILED.createException(e, offsetX, offsetY, e.getMessage());
        }
    }

    @Override
    public void encode(Raster raster, OutputStream out, String format) {
        String formatName = format == null ? "" : format.toLowerCase(Locale.ROOT);
        if (!ImageIO.getImageWritersByFormatName(formatName).hasNext()) {
            throw BoxfitError.INVALID_FORMAT.createException(format);
        }
        BufferedImage image = OPAQUE_FORMATS.contains(formatName)
                ? flatten(raster.getImage())
                : raster.getImage();
        try {
            if (!ImageIO.write(image, formatName, out)) {
                throw BoxfitError.ENCODE_FAILED.createException(formatName, "no writer accepted the image");
            }
        } catch (IOException e) {
            throw BoxfitError.ENCODE_FAILED.createException(e, formatName, e.getMessage());
        }
    }

    @Override
    public String detectFormat(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw BoxfitError.IMAGE_NOT_FOUND.createException(path);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw BoxfitError.DECODE_FAILED.createException(path);
            }
            ImageReader reader = readers.next();
            try {
                return reader.getFormatName().toLowerCase(Locale.ROOT);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw BoxfitError.DECODE_FAILED.createException(e, path);
        }
    }

    private Raster read(InputStream in, String description) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw BoxfitError.DECODE_FAILED.createException(description);
        }
        log.debug("Decoded {} into {}x{} image", description, image.getWidth(), image.getHeight());
        return Raster.of(image);
    }

    private BufferedImage rotateQuadrant(BufferedImage source, int degrees) {
        int w = source.getWidth();
        int h = source.getHeight();
        int[] in = source.getRGB(0, 0, w, h, null, 0, w);
        boolean swap = degrees != 180;
        int outWidth = swap ? h : w;
        int outHeight = swap ? w : h;
        int[] out = new int[in.length];
        for (int y = 0; y < outHeight; y++) {
            for (int x = 0; x < outWidth; x++) {
                int sx;
                int sy;
                if (degrees == 90) {
                    sx = y;
                    sy = h - 1 - x;
                } else if (degrees == 270) {
                    sx = w - 1 - y;
                    sy = x;
                } else {
                    sx = w - 1 - x;
                    sy = h - 1 - y;
                }
                out[y * outWidth + x] = in[sy * w + sx];
            }
        }
        BufferedImage rotated = new BufferedImage(outWidth, outHeight, BufferedImage.TYPE_INT_ARGB);
        rotated.setRGB(0, 0, outWidth, outHeight, out, 0, outWidth);
        return rotated;
    }

    private BufferedImage rotateFree(BufferedImage source, double degrees, Color fill) {
        double radians = Math.toRadians(degrees);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int w = source.getWidth();
        int h = source.getHeight();
        int outWidth = (int) Math.ceil(w * cos + h * sin);
        int outHeight = (int) Math.ceil(w * sin + h * cos);

        BufferedImage rotated = new BufferedImage(outWidth, outHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = rotated.createGraphics();
        try {
            g.setColor(fill);
            g.fillRect(0, 0, outWidth, outHeight);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            AffineTransform transform = new AffineTransform();
            transform.translate(outWidth / 2.0, outHeight / 2.0);
            transform.rotate(radians);
            transform.translate(-w / 2.0, -h / 2.0);
            g.drawImage(source, transform, null);
        } finally {
            g.dispose();
        }
        return rotated;
    }

    private BufferedImage bicubic(BufferedImage source, int width, int height) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    // Drops detail by averaging down to 1/blur of the target, then interpolates back up.
    private BufferedImage softened(BufferedImage source, int width, int height, double blur) {
        int smallWidth = Math.max(1, (int) Math.round(width / blur));
        int smallHeight = Math.max(1, (int) Math.round(height / blur));
        BufferedImage reduced = AreaAveragingResampler.resample(source, smallWidth, smallHeight);
        return bicubic(reduced, width, height);
    }

    private BufferedImage flatten(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        BufferedImage opaque = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = opaque.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return opaque;
    }
}
