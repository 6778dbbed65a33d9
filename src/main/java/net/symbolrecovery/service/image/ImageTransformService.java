package net.symbolrecovery.service.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.DataBufferInt;
import java.awt.image.Kernel;
import java.util.Arrays;
import net.symbolrecovery.util.image.LuminanceAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Geometric and photometric transforms used by the recovery strategies
 *
 * Features:
 * - Rotates onto an enlarged canvas so no corner of the symbol is clipped
 * - Rescales by arbitrary positive factors with bilinear interpolation
 * - Approximates perspective skew with a horizontal shear about the center
 * - Stretches contrast around mid-gray per channel
 * - Removes salt-and-pepper noise with a luminance median filter
 * - Sharpens edges with a fixed 3x3 kernel
 *
 * Every method is stateless and returns a newly allocated {@code TYPE_INT_RGB} image; the
 * input image is never written to. Uncovered canvas areas are filled with white, which
 * reads as quiet zone to the decoder.
 */
@Service
public class ImageTransformService {

    private static final Logger logger = LoggerFactory.getLogger(ImageTransformService.class);

    static final int MID_GRAY = 128;
    static final int DEFAULT_MEDIAN_WINDOW = 3;
    private static final int BACKGROUND_RGB = Color.WHITE.getRGB();
    private static final float[] SHARPEN_KERNEL = {
        0f, -1f, 0f,
        -1f, 5f, -1f,
        0f, -1f, 0f
    };

    /**
     * Copies any image type (binary, indexed, translucent) into a fresh opaque RGB image.
     * Transparent areas become white.
     *
     * @param image source image
     * @return a new {@code TYPE_INT_RGB} image with the same dimensions
     */
    public BufferedImage toRgb(BufferedImage image) {
        BufferedImage copy = blankCanvas(image.getWidth(), image.getHeight());
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    /**
     * Rotates the image about its center.
     *
     * @param image source image
     * @param angleDegrees rotation angle, clockwise in screen coordinates
     * @return a new image sized to the bounding box of the rotated rectangle
     */
    public BufferedImage rotate(BufferedImage image, double angleDegrees) {
        double radians = Math.toRadians(angleDegrees);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int width = image.getWidth();
        int height = image.getHeight();

        int newWidth = (int) Math.round(width * cos + height * sin);
        int newHeight = (int) Math.round(width * sin + height * cos);
        requireDrawable(newWidth, newHeight, "rotate by " + angleDegrees);

        BufferedImage rotated = blankCanvas(newWidth, newHeight);
        Graphics2D g2d = rotated.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.translate(newWidth / 2.0, newHeight / 2.0);
            g2d.rotate(radians);
            g2d.translate(-width / 2.0, -height / 2.0);
            g2d.drawImage(image, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        logger.debug("Rotated {}x{} image by {} degrees onto {}x{} canvas.", width, height, angleDegrees, newWidth, newHeight);
        return rotated;
    }

    /**
     * Resamples the image by a uniform factor. Target dimensions are truncated.
     *
     * @param image source image
     * @param factor scale factor; below 1 shrinks, above 1 enlarges
     * @return a new image of {@code (int)(W*factor) x (int)(H*factor)}
     * @throws IllegalArgumentException if the factor is not a positive finite number or the
     *         result would have no pixels
     */
    public BufferedImage scale(BufferedImage image, double factor) {
        if (!(factor > 0.0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Scale factor must be positive and finite but was " + factor);
        }
        int newWidth = (int) (image.getWidth() * factor);
        int newHeight = (int) (image.getHeight() * factor);
        requireDrawable(newWidth, newHeight, "scale by " + factor);

        BufferedImage scaled = blankCanvas(newWidth, newHeight);
        Graphics2D g2d = scaled.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.drawImage(image, 0, 0, newWidth, newHeight, null);
        } finally {
            g2d.dispose();
        }
        logger.debug("Scaled {}x{} image by {} to {}x{}.", image.getWidth(), image.getHeight(), factor, newWidth, newHeight);
        return scaled;
    }

    /**
     * Applies the horizontal shear {@code x' = x + y * tan(angle)} about the image center.
     * The canvas keeps its size, so strongly sheared corners are clipped.
     *
     * @param image source image
     * @param skewAngleDegrees shear angle; negative values lean the other way
     * @return a new image with the source dimensions
     */
    public BufferedImage shear(BufferedImage image, double skewAngleDegrees) {
        double shearFactor = Math.tan(Math.toRadians(skewAngleDegrees));
        if (Double.isNaN(shearFactor) || Double.isInfinite(shearFactor)) {
            throw new IllegalArgumentException("Shear angle has no finite tangent: " + skewAngleDegrees);
        }
        int width = image.getWidth();
        int height = image.getHeight();

        BufferedImage sheared = blankCanvas(width, height);
        Graphics2D g2d = sheared.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.translate(width / 2.0, height / 2.0);
            g2d.shear(shearFactor, 0.0);
            g2d.translate(-width / 2.0, -height / 2.0);
            g2d.drawImage(image, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return sheared;
    }

    /**
     * Remaps every channel with {@code clamp(0, 255, (v - 128) * factor + 128)}.
     *
     * @param image source image
     * @param factor above 1 increases contrast, between 0 and 1 reduces it
     * @return a new image with the source dimensions
     */
    public BufferedImage enhanceContrast(BufferedImage image, double factor) {
        if (!(factor > 0.0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Contrast factor must be positive and finite but was " + factor);
        }
        BufferedImage enhanced = toRgb(image);
        int[] pixels = pixelsOf(enhanced);
        for (int i = 0; i < pixels.length; i++) {
            int rgb = pixels[i];
            int r = stretch((rgb >> 16) & 0xFF, factor);
            int g = stretch((rgb >> 8) & 0xFF, factor);
            int b = stretch(rgb & 0xFF, factor);
            pixels[i] = (r << 16) | (g << 8) | b;
        }
        return enhanced;
    }

    /**
     * Median filter over the default 3x3 window.
     *
     * @see #denoiseMedian(BufferedImage, int)
     */
    public BufferedImage denoiseMedian(BufferedImage image) {
        return denoiseMedian(image, DEFAULT_MEDIAN_WINDOW);
    }

    /**
     * Replaces each interior pixel with the median luminance of its neighborhood, written back
     * as a gray pixel. Pixels closer than {@code windowSize / 2} to an edge are copied unchanged.
     *
     * @param image source image
     * @param windowSize odd window edge length, at least 3
     * @return a new image with the source dimensions
     */
    public BufferedImage denoiseMedian(BufferedImage image, int windowSize) {
        if (windowSize < 3 || windowSize % 2 == 0) {
            throw new IllegalArgumentException("Median window must be an odd size of at least 3 but was " + windowSize);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int offset = windowSize / 2;

        // Medians come from the flattened copy so transparent areas read as white
        BufferedImage filtered = toRgb(image);
        int[] luminance = LuminanceAnalyzer.toLuminance(filtered);
        int[] pixels = pixelsOf(filtered);
        int[] window = new int[windowSize * windowSize];

        for (int y = offset; y < height - offset; y++) {
            for (int x = offset; x < width - offset; x++) {
                int index = 0;
                for (int dy = -offset; dy <= offset; dy++) {
                    int rowOffset = (y + dy) * width;
                    for (int dx = -offset; dx <= offset; dx++) {
                        window[index++] = luminance[rowOffset + x + dx];
                    }
                }
                Arrays.sort(window);
                int median = window[window.length / 2];
                pixels[y * width + x] = (median << 16) | (median << 8) | median;
            }
        }
        return filtered;
    }

    /**
     * Convolves with {@code [[0,-1,0],[-1,5,-1],[0,-1,0]]}. Border pixels pass through unmodified.
     *
     * @param image source image
     * @return a new image with the source dimensions
     */
    public BufferedImage sharpen(BufferedImage image) {
        ConvolveOp op = new ConvolveOp(new Kernel(3, 3, SHARPEN_KERNEL), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage source = toRgb(image);
        BufferedImage sharpened = blankCanvas(source.getWidth(), source.getHeight());
        op.filter(source, sharpened);
        return sharpened;
    }

    private static int stretch(int value, double factor) {
        int stretched = (int) ((value - MID_GRAY) * factor + MID_GRAY);
        return Math.max(0, Math.min(255, stretched));
    }

    private static BufferedImage blankCanvas(int width, int height) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Arrays.fill(pixelsOf(canvas), BACKGROUND_RGB & 0xFFFFFF);
        return canvas;
    }

    private static int[] pixelsOf(BufferedImage rgbImage) {
        return ((DataBufferInt) rgbImage.getRaster().getDataBuffer()).getData();
    }

    private static void requireDrawable(int width, int height, String operation) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Cannot %s: result would be %dx%d".formatted(operation, width, height));
        }
    }
}
