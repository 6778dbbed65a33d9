package net.symbolrecovery.util.image;

import java.awt.image.BufferedImage;
import net.symbolrecovery.exception.InvalidImageException;

/**
 * Single place where caller-supplied images are checked before any recovery or assessment work.
 */
public final class ImageInputValidator {

    private ImageInputValidator() {
    }

    /**
     * Rejects images that cannot be processed at all.
     *
     * @param image the caller's image
     * @param operation name of the public operation, used in the message
     * @return the same image, for chaining
     * @throws InvalidImageException when the image is null or has no pixels
     */
    public static BufferedImage requireUsable(BufferedImage image, String operation) {
        if (image == null) {
            throw new InvalidImageException(operation + " requires an image but received null");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidImageException("%s requires positive dimensions but received %dx%d"
                .formatted(operation, image.getWidth(), image.getHeight()));
        }
        return image;
    }
}
