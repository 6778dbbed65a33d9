package net.symbolrecovery.model.decode;

/**
 * Binarization policies a decode backend must be able to apply before symbol decoding.
 */
public enum BinarizerKind {

    /** Local thresholds computed per block; the default for photographs with uneven lighting. */
    ADAPTIVE,

    /** One threshold derived from the luminance histogram of the whole image. */
    GLOBAL_HISTOGRAM
}
