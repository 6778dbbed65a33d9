package net.symbolrecovery.application.recovery;

import java.awt.image.BufferedImage;
import net.symbolrecovery.model.damage.DamageReport;
import net.symbolrecovery.model.recovery.RecoveryDiagnosis;
import net.symbolrecovery.model.recovery.RecoveryResult;
import net.symbolrecovery.service.damage.DamageAssessmentService;
import net.symbolrecovery.util.image.ImageInputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pairs a recovery run with a damage assessment when the run comes back empty, so callers
 * can explain a failed read instead of just reporting it.
 */
@Service
public class RecoveryDiagnosticsService {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryDiagnosticsService.class);

    private final RecoveryPipeline recoveryPipeline;
    private final DamageAssessmentService damageAssessmentService;

    public RecoveryDiagnosticsService(RecoveryPipeline recoveryPipeline,
                                      DamageAssessmentService damageAssessmentService) {
        this.recoveryPipeline = recoveryPipeline;
        this.damageAssessmentService = damageAssessmentService;
    }

    /**
     * Recovers the symbol and, only if that fails, assesses the image damage.
     *
     * @param image the caller's image; never modified
     * @return the recovery result plus a damage report for unrecovered images
     * @throws net.symbolrecovery.exception.InvalidImageException if the image is null or empty
     */
    public RecoveryDiagnosis diagnose(BufferedImage image) {
        ImageInputValidator.requireUsable(image, "diagnose");
        RecoveryResult result = recoveryPipeline.recover(image);
        if (result.isRecovered()) {
            return new RecoveryDiagnosis(result, null);
        }
        DamageReport damage = damageAssessmentService.assess(image);
        logger.info("Unrecovered {}x{} image diagnosed: {}", image.getWidth(), image.getHeight(), damage.summary());
        return new RecoveryDiagnosis(result, damage);
    }
}
