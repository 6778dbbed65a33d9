package net.symbolrecovery.model.recovery;

import jakarta.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import net.symbolrecovery.model.damage.DamageReport;

/**
 * A recovery result paired with the damage assessment that explains a failed run.
 *
 * @param result outcome of the recovery run
 * @param damage assessment of the input, present only when nothing was recovered
 */
public record RecoveryDiagnosis(RecoveryResult result, @Nullable DamageReport damage) {

    public RecoveryDiagnosis {
        Objects.requireNonNull(result, "result must not be null");
    }

    public Optional<DamageReport> damageReport() {
        return Optional.ofNullable(damage);
    }
}
