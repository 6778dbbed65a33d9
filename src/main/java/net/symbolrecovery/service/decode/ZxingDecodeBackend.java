package net.symbolrecovery.service.decode;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.Binarizer;
import com.google.zxing.ChecksumException;
import com.google.zxing.DecodeHintType;
import com.google.zxing.FormatException;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.GlobalHistogramBinarizer;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;
import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import net.symbolrecovery.config.RecoveryProperties;
import net.symbolrecovery.model.decode.BinarizerKind;
import net.symbolrecovery.model.decode.DecodeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link DecodeBackend} backed by ZXing's QR code reader.
 *
 * <p>A new reader is created for every call, so one instance can serve concurrent callers.
 * Decode hints are resolved once from {@link RecoveryProperties} and never change.</p>
 */
@Service
public class ZxingDecodeBackend implements DecodeBackend {

    private static final Logger logger = LoggerFactory.getLogger(ZxingDecodeBackend.class);

    private final Map<DecodeHintType, Object> hints;

    public ZxingDecodeBackend(RecoveryProperties properties) {
        this.hints = buildHints(properties);
    }

    @Override
    public DecodeOutcome decode(BufferedImage image, BinarizerKind binarizer) {
        try {
            LuminanceSource source = new BufferedImageLuminanceSource(image);
            BinaryBitmap bitmap = new BinaryBitmap(createBinarizer(source, binarizer));
            Result result = new QRCodeReader().decode(bitmap, hints);
            return DecodeOutcome.success(result.getText());
        } catch (NotFoundException e) {
            return DecodeOutcome.notFound();
        } catch (ChecksumException e) {
            logger.debug("Symbol located with {} binarizer but error correction failed.", binarizer);
            return DecodeOutcome.checksumInvalid();
        } catch (FormatException e) {
            logger.debug("Symbol located with {} binarizer but format information is invalid.", binarizer);
            return DecodeOutcome.formatInvalid();
        } catch (RuntimeException e) {
            logger.warn("Unexpected decoder failure with {} binarizer on {}x{} image: {}",
                binarizer, image.getWidth(), image.getHeight(), e.getMessage(), e);
            return DecodeOutcome.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    Map<DecodeHintType, Object> hints() {
        return hints;
    }

    private static Binarizer createBinarizer(LuminanceSource source, BinarizerKind kind) {
        return switch (kind) {
            case ADAPTIVE -> new HybridBinarizer(source);
            case GLOBAL_HISTOGRAM -> new GlobalHistogramBinarizer(source);
        };
    }

    private static Map<DecodeHintType, Object> buildHints(RecoveryProperties properties) {
        Map<DecodeHintType, Object> resolved = new EnumMap<>(DecodeHintType.class);
        if (properties.isDecoderTryHarder()) {
            resolved.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        }
        if (properties.isDecoderPureBarcode()) {
            resolved.put(DecodeHintType.PURE_BARCODE, Boolean.TRUE);
        }
        resolved.put(DecodeHintType.CHARACTER_SET, properties.getDecoderCharacterSet());
        return Collections.unmodifiableMap(resolved);
    }
}
