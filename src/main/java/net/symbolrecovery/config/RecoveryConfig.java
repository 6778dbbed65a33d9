/**
 * Wiring for the recovery and assessment services
 *
 * Features:
 * - Chooses the contrast pixel sampler from {@link RecoveryProperties}
 * - Supplies an in-memory meter registry when no monitoring backend registers one
 */
package net.symbolrecovery.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.symbolrecovery.service.damage.FullScanPixelSampler;
import net.symbolrecovery.service.damage.PixelSampler;
import net.symbolrecovery.service.damage.RandomPixelSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecoveryConfig {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryConfig.class);

    /**
     * Pixel sampler used by damage assessment to estimate contrast.
     *
     * @param properties recovery configuration
     * @return a full-scan sampler when configured, otherwise a random sampler
     */
    @Bean
    public PixelSampler contrastPixelSampler(RecoveryProperties properties) {
        if (properties.isFullScanContrast()) {
            logger.info("Contrast estimation scans every pixel.");
            return new FullScanPixelSampler();
        }
        if (properties.getSamplerSeed() != null) {
            logger.info("Contrast estimation samples {} pixels with fixed seed {}.",
                properties.getContrastSampleSize(), properties.getSamplerSeed());
        }
        return new RandomPixelSampler(properties.getContrastSampleSize(), properties.getSamplerSeed());
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry recoveryMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
