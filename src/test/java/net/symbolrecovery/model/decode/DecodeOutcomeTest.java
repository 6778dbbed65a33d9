package net.symbolrecovery.model.decode;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecodeOutcomeTest {

    @Test
    void should_CarryText_When_Successful() {
        DecodeOutcome outcome = DecodeOutcome.success("payload");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.content()).contains("payload");
        assertThat(outcome.reason()).isNull();
    }

    @Test
    void should_DescribeFailure_When_DecoderRejectsSymbol() {
        assertThat(DecodeOutcome.notFound().reason()).isEqualTo(DecodeStatus.NOT_FOUND.description());
        assertThat(DecodeOutcome.checksumInvalid().status()).isEqualTo(DecodeStatus.CHECKSUM_INVALID);
        assertThat(DecodeOutcome.formatInvalid().content()).isEmpty();
    }

    @Test
    void should_FallBackToStatusDescription_When_ErrorReasonIsNull() {
        assertThat(DecodeOutcome.error(null).reason()).isEqualTo(DecodeStatus.ERROR.description());
        assertThat(DecodeOutcome.error("boom").reason()).isEqualTo("boom");
    }

    @Test
    void should_RejectText_When_StatusIsNotSuccess() {
        assertThatThrownBy(() -> new DecodeOutcome(DecodeStatus.NOT_FOUND, "text", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DecodeOutcome(DecodeStatus.SUCCESS, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
