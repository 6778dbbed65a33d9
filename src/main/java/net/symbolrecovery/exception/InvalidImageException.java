package net.symbolrecovery.exception;

/**
 * The caller passed an image that cannot be processed at all (null or without pixels).
 * RETRYABLE: No (the same input fails again)
 *
 * <p>Distinct from strategy failures, which the recovery pipeline absorbs: this is the only
 * error {@code recover}, {@code assess} and {@code diagnose} raise for their input.</p>
 */
public class InvalidImageException extends IllegalArgumentException {

    /** Creates an exception describing why the input image was rejected. */
    public InvalidImageException(String message) {
        super(message);
    }
}
