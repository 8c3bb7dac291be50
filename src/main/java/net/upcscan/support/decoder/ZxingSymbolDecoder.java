package net.upcscan.support.decoder;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.PlanarYUVLuminanceSource;
import com.google.zxing.Result;
import com.google.zxing.ResultMetadataType;
import com.google.zxing.common.HybridBinarizer;
import lombok.extern.slf4j.Slf4j;
import net.upcscan.model.scan.DecodeHit;
import net.upcscan.model.scan.Symbology;
import net.upcscan.util.image.ImageOps;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link SymbolDecoder} backed by ZXing's one-dimensional UPC/EAN readers.
 *
 * <p>ZXing reports an EAN-5 add-on as {@link ResultMetadataType#UPC_EAN_EXTENSION}
 * metadata on the primary symbol; it is surfaced here as its own {@link DecodeHit}.
 * Two-digit add-ons are ignored.</p>
 */
@Slf4j
public class ZxingSymbolDecoder implements SymbolDecoder {

    private static final int EAN5_LENGTH = 5;

    @Override
    public List<DecodeHit> decode(Mat image, Set<Symbology> allowed) {
        Set<BarcodeFormat> formats = primaryFormats(allowed);
        if (formats.isEmpty()) {
            return List.of();
        }

        int width = image.cols();
        int height = image.rows();
        LuminanceSource source = new PlanarYUVLuminanceSource(
                ImageOps.toLuminance(image), width, height, 0, 0, width, height, false);
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));

        MultiFormatReader reader = new MultiFormatReader();
        try {
            Result result = reader.decode(bitmap, hints(formats));
            return toHits(result, allowed);
        } catch (NotFoundException e) {
            // MultiFormatReader folds checksum and format rejections into NotFoundException
            log.trace("No UPC/EAN symbol in {}x{} image", width, height);
            return List.of();
        } finally {
            reader.reset();
        }
    }

    private static Map<DecodeHintType, Object> hints(Set<BarcodeFormat> formats) {
        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        hints.put(DecodeHintType.POSSIBLE_FORMATS, formats);
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        return hints;
    }

    private static Set<BarcodeFormat> primaryFormats(Set<Symbology> allowed) {
        Set<BarcodeFormat> formats = EnumSet.noneOf(BarcodeFormat.class);
        for (Symbology symbology : allowed) {
            switch (symbology) {
                case UPCA -> formats.add(BarcodeFormat.UPC_A);
                case UPCE -> formats.add(BarcodeFormat.UPC_E);
                case EAN13 -> formats.add(BarcodeFormat.EAN_13);
                case EAN5 -> { }
            }
        }
        return formats;
    }

    private static List<DecodeHit> toHits(Result result, Set<Symbology> allowed) {
        List<DecodeHit> hits = new ArrayList<>(2);
        Symbology symbology = switch (result.getBarcodeFormat()) {
            case UPC_A -> Symbology.UPCA;
            case UPC_E -> Symbology.UPCE;
            case EAN_13 -> Symbology.EAN13;
            default -> null;
        };
        if (symbology == null || result.getText() == null || result.getText().isBlank()) {
            return hits;
        }
        hits.add(new DecodeHit(symbology, result.getText()));

        Map<ResultMetadataType, Object> metadata = result.getResultMetadata();
        if (allowed.contains(Symbology.EAN5) && metadata != null) {
            Object extension = metadata.get(ResultMetadataType.UPC_EAN_EXTENSION);
            if (extension instanceof String addOn && addOn.length() == EAN5_LENGTH) {
                hits.add(new DecodeHit(Symbology.EAN5, addOn));
            }
        }
        log.debug("Decoded {} {}{}", symbology, result.getText(), hits.size() > 1 ? " + EAN5 " + hits.get(1).payload() : "");
        return hits;
    }
}
