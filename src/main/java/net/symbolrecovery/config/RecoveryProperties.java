package net.symbolrecovery.config;

import jakarta.annotation.PostConstruct;
import java.nio.charset.Charset;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for symbol recovery and damage assessment.
 */
@Component
@ConfigurationProperties(prefix = "symbol-recovery")
public class RecoveryProperties {

    /**
     * Number of random pixels sampled when estimating contrast.
     */
    private int contrastSampleSize = 1000;

    /**
     * Seed for the contrast sampler; unset means a fresh random sequence per assessment.
     */
    private Long samplerSeed;

    /**
     * Whether contrast is measured over every pixel instead of a random sample.
     */
    private boolean fullScanContrast = false;

    /**
     * Whether the decoder spends extra time looking for a symbol.
     */
    private boolean decoderTryHarder = false;

    /**
     * Character set assumed for byte-mode payloads that carry no ECI marker.
     */
    private String decoderCharacterSet = "UTF-8";

    /**
     * Whether images are assumed to contain nothing but a single, unrotated symbol.
     */
    private boolean decoderPureBarcode = false;

    @PostConstruct
    void validate() {
        Assert.isTrue(contrastSampleSize > 0, "symbol-recovery.contrast-sample-size must be positive");
        Assert.isTrue(StringUtils.hasText(decoderCharacterSet),
                "symbol-recovery.decoder-character-set must not be blank");
        Assert.isTrue(Charset.isSupported(decoderCharacterSet),
                "symbol-recovery.decoder-character-set is not supported by this JVM: " + decoderCharacterSet);
    }

    public int getContrastSampleSize() {
        return contrastSampleSize;
    }

    public void setContrastSampleSize(int contrastSampleSize) {
        this.contrastSampleSize = contrastSampleSize;
    }

    public Long getSamplerSeed() {
        return samplerSeed;
    }

    public void setSamplerSeed(Long samplerSeed) {
        this.samplerSeed = samplerSeed;
    }

    public boolean isFullScanContrast() {
        return fullScanContrast;
    }

    public void setFullScanContrast(boolean fullScanContrast) {
        this.fullScanContrast = fullScanContrast;
    }

    public boolean isDecoderTryHarder() {
        return decoderTryHarder;
    }

    public void setDecoderTryHarder(boolean decoderTryHarder) {
        this.decoderTryHarder = decoderTryHarder;
    }

    public String getDecoderCharacterSet() {
        return decoderCharacterSet;
    }

    public void setDecoderCharacterSet(String decoderCharacterSet) {
        this.decoderCharacterSet = StringUtils.hasText(decoderCharacterSet) ? decoderCharacterSet.trim() : "UTF-8";
    }

    public boolean isDecoderPureBarcode() {
        return decoderPureBarcode;
    }

    public void setDecoderPureBarcode(boolean decoderPureBarcode) {
        this.decoderPureBarcode = decoderPureBarcode;
    }
}
