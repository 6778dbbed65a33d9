package net.symbolrecovery.model.decode;

/**
 * Enumerates the outcomes a single decode attempt can produce.
 *
 * <p>Only {@link #SUCCESS} ends a recovery run. Every other value is non-fatal: the
 * pipeline treats "almost decoded" (checksum failure) exactly like "nothing found"
 * and moves on to the next candidate.</p>
 */
public enum DecodeStatus {

    SUCCESS("Symbol decoded"),
    NOT_FOUND("No symbol located in image"),
    CHECKSUM_INVALID("Symbol located but error correction failed"),
    FORMAT_INVALID("Symbol located but format information is invalid"),
    ERROR("Decoder failed unexpectedly");

    private final String description;

    DecodeStatus(String description) {
        this.description = description;
    }

    /** Human-readable description suitable for log messages. */
    public String description() {
        return description;
    }
}
