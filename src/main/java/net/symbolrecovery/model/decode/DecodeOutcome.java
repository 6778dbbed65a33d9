package net.symbolrecovery.model.decode;

import jakarta.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single decode attempt against one image with one binarizer.
 *
 * @param status what the decoder reported
 * @param text decoded payload; non-null only for {@link DecodeStatus#SUCCESS}
 * @param reason failure detail for {@link DecodeStatus#ERROR}, otherwise the status description
 */
public record DecodeOutcome(DecodeStatus status, @Nullable String text, @Nullable String reason) {

    public DecodeOutcome {
        Objects.requireNonNull(status, "status must not be null");
        if (status == DecodeStatus.SUCCESS && text == null) {
            throw new IllegalArgumentException("successful decode outcome requires text");
        }
        if (status != DecodeStatus.SUCCESS && text != null) {
            throw new IllegalArgumentException("only successful decode outcomes carry text");
        }
    }

    public static DecodeOutcome success(String text) {
        return new DecodeOutcome(DecodeStatus.SUCCESS, Objects.requireNonNull(text, "text"), null);
    }

    public static DecodeOutcome notFound() {
        return new DecodeOutcome(DecodeStatus.NOT_FOUND, null, DecodeStatus.NOT_FOUND.description());
    }

    public static DecodeOutcome checksumInvalid() {
        return new DecodeOutcome(DecodeStatus.CHECKSUM_INVALID, null, DecodeStatus.CHECKSUM_INVALID.description());
    }

    public static DecodeOutcome formatInvalid() {
        return new DecodeOutcome(DecodeStatus.FORMAT_INVALID, null, DecodeStatus.FORMAT_INVALID.description());
    }

    public static DecodeOutcome error(String reason) {
        return new DecodeOutcome(DecodeStatus.ERROR, null,
            reason != null ? reason : DecodeStatus.ERROR.description());
    }

    public boolean isSuccess() {
        return status == DecodeStatus.SUCCESS;
    }

    /** Decoded text, present only on success. */
    public Optional<String> content() {
        return Optional.ofNullable(text);
    }
}
