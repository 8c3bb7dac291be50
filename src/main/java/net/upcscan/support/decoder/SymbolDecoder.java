package net.upcscan.support.decoder;

import net.upcscan.model.scan.DecodeHit;
import net.upcscan.model.scan.Symbology;
import org.opencv.core.Mat;

import java.util.List;
import java.util.Set;

/**
 * Bit-level symbol reader: turns a grayscale or binarized image into decoded symbols.
 *
 * <p>Absence of a symbol is an empty list, never an exception.</p>
 */
public interface SymbolDecoder {

    /**
     * Decodes every symbol of the allowed symbologies found in the image.
     *
     * @param image single-channel 8-bit image; not modified
     * @param allowed symbologies the caller is interested in
     * @return hits in decoder order; empty when nothing was recognised
     */
    List<DecodeHit> decode(Mat image, Set<Symbology> allowed);
}
