package net.symbolrecovery.util.image;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

/**
 * Extracts 8-bit luminance from a {@link BufferedImage}.
 *
 * <p>Weights are {@value #RED_WEIGHT}/{@value #GREEN_WEIGHT}/{@value #BLUE_WEIGHT} out of 1024,
 * rounded, which is exact for gray pixels (R = G = B) and matches the luminance source the
 * symbol decoder binarizes. Like that source, fully transparent pixels read as white and any
 * other alpha value is ignored.</p>
 */
public final class LuminanceAnalyzer {

    static final int RED_WEIGHT = 306;
    static final int GREEN_WEIGHT = 601;
    static final int BLUE_WEIGHT = 117;
    static final int TRANSPARENT_LUMINANCE = 0xFF;

    private LuminanceAnalyzer() {
    }

    /**
     * Luminance of one packed RGB pixel.
     *
     * @param rgb pixel in {@code 0xAARRGGBB} layout; alpha is ignored
     * @return luminance in [0,255]
     */
    public static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b + 0x200) >> 10;
    }

    /**
     * Luminance of one pixel as returned by {@link BufferedImage#getRGB(int, int)}.
     *
     * @param argb pixel in {@code 0xAARRGGBB} layout
     * @return {@value #TRANSPARENT_LUMINANCE} for fully transparent pixels, otherwise
     *         {@link #luminance(int)}
     */
    public static int luminanceArgb(int argb) {
        if ((argb & 0xFF000000) == 0) {
            return TRANSPARENT_LUMINANCE;
        }
        return luminance(argb);
    }

    /**
     * Luminance of every pixel, row-major ({@code index = y * width + x}).
     *
     * @param image the image to read; never modified
     * @return a new array of length {@code width * height}
     */
    public static int[] toLuminance(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] luminance = new int[width * height];

        // Direct pixel array access for TYPE_INT_RGB / TYPE_INT_ARGB
        int type = image.getType();
        boolean directAccess = (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_INT_ARGB)
                && image.getRaster().getDataBuffer() instanceof DataBufferInt
                && image.getRaster().getParent() == null;

        if (directAccess) {
            int[] pixels = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
            // TYPE_INT_RGB stores no alpha byte, so only ARGB data is checked for transparency
            boolean hasAlpha = type == BufferedImage.TYPE_INT_ARGB;
            for (int i = 0; i < luminance.length; i++) {
                luminance[i] = hasAlpha ? luminanceArgb(pixels[i]) : luminance(pixels[i]);
            }
        } else {
            int[] row = new int[width];
            for (int y = 0; y < height; y++) {
                image.getRGB(0, y, width, 1, row, 0, width);
                int rowOffset = y * width;
                for (int x = 0; x < width; x++) {
                    luminance[rowOffset + x] = luminanceArgb(row[x]);
                }
            }
        }
        return luminance;
    }
}
