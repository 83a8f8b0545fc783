package org.boxfit.engine;

import java.awt.image.BufferedImage;

/**
 * Box-filter resampling: every destination pixel is the coverage-weighted mean of the source
 * pixels under it. An exact halving averages each 2x2 block.
 * <p>
 * Works on premultiplied channels so transparent pixels do not bleed their color.
 */
final class AreaAveragingResampler {

    private static final int CHANNELS = 4;

    private AreaAveragingResampler() {
    }

    static BufferedImage resample(BufferedImage source, int targetWidth, int targetHeight) {
        int sourceWidth = source.getWidth();
        int sourceHeight = source.getHeight();
        int[] argb = source.getRGB(0, 0, sourceWidth, sourceHeight, null, 0, sourceWidth);

        float[][] planes = premultiply(argb);
        float[][] horizontal = resampleRows(planes, sourceWidth, sourceHeight, targetWidth);
        float[][] scaled = resampleColumns(horizontal, targetWidth, sourceHeight, targetHeight);

        BufferedImage result = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        result.setRGB(0, 0, targetWidth, targetHeight, unpremultiply(scaled), 0, targetWidth);
        return result;
    }

    private static float[][] premultiply(int[] argb) {
        float[][] planes = new float[CHANNELS][argb.length];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            float a = (p >>> 24) / 255f;
            planes[0][i] = a;
            planes[1][i] = ((p >> 16) & 0xFF) * a;
            planes[2][i] = ((p >> 8) & 0xFF) * a;
            planes[3][i] = (p & 0xFF) * a;
        }
        return planes;
    }

    private static int[] unpremultiply(float[][] planes) {
        int length = planes[0].length;
        int[] argb = new int[length];
        for (int i = 0; i < length; i++) {
            float a = planes[0][i];
            if (a <= 0f) {
                continue;
            }
            int alpha = clamp(Math.round(a * 255f));
            int r = clamp(Math.round(planes[1][i] / a));
            int g = clamp(Math.round(planes[2][i] / a));
            int b = clamp(Math.round(planes[3][i] / a));
            argb[i] = (alpha << 24) | (r << 16) | (g << 8) | b;
        }
        return argb;
    }

    private static float[][] resampleRows(float[][] in, int inWidth, int rows, int outWidth) {
        Span[] spans = spans(inWidth, outWidth);
        float[][] out = new float[CHANNELS][outWidth * rows];
        for (int c = 0; c < CHANNELS; c++) {
            float[] src = in[c];
            float[] dst = out[c];
            for (int y = 0; y < rows; y++) {
                int inRow = y * inWidth;
                int outRow = y * outWidth;
                for (int x = 0; x < outWidth; x++) {
                    dst[outRow + x] = spans[x].apply(src, inRow, 1);
                }
            }
        }
        return out;
    }

    private static float[][] resampleColumns(float[][] in, int columns, int inHeight, int outHeight) {
        Span[] spans = spans(inHeight, outHeight);
        float[][] out = new float[CHANNELS][columns * outHeight];
        for (int c = 0; c < CHANNELS; c++) {
            float[] src = in[c];
            float[] dst = out[c];
            for (int y = 0; y < outHeight; y++) {
                Span span = spans[y];
                int outRow = y * columns;
                for (int x = 0; x < columns; x++) {
                    dst[outRow + x] = span.apply(src, x, columns);
                }
            }
        }
        return out;
    }

    private static Span[] spans(int inLength, int outLength) {
        double scale = (double) inLength / outLength;
        Span[] spans = new Span[outLength];
        for (int i = 0; i < outLength; i++) {
            double start = i * scale;
            double end = Math.min(inLength, (i + 1) * scale);
            int first = (int) Math.floor(start);
            int last = Math.min(inLength - 1, (int) Math.ceil(end) - 1);
            int count = Math.max(1, last - first + 1);
            float[] weights = new float[count];
            for (int k = 0; k < count; k++) {
                int j = first + k;
                double coverage = Math.min(end, j + 1) - Math.max(start, j);
                weights[k] = (float) (Math.max(0.0, coverage) / (end - start));
            }
            spans[i] = new Span(first, weights);
        }
        return spans;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    private record Span(int first, float[] weights) {

        float apply(float[] src, int base, int stride) {
            float sum = 0f;
            int index = base + first * stride;
            for (float weight : weights) {
                sum += src[index] * weight;
                index += stride;
            }
            return sum;
        }
    }
}
