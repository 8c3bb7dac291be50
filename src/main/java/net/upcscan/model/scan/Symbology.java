package net.upcscan.model.scan;

import java.util.EnumSet;
import java.util.Set;

/**
 * Retail symbologies the scanner asks the decoder for.
 *
 * <p>UPC-A, UPC-E and EAN-13 carry the product identifier; EAN-5 is the price
 * add-on printed beside the main symbol.</p>
 */
public enum Symbology {

    UPCA(true),
    UPCE(true),
    EAN13(true),
    EAN5(false);

    /** The fixed set passed to every decoder invocation. */
    public static final Set<Symbology> RETAIL = EnumSet.allOf(Symbology.class);

    private final boolean primary;

    Symbology(boolean primary) {
        this.primary = primary;
    }

    /** Whether hits of this symbology populate {@link ScanResult#main()}. */
    public boolean isPrimary() {
        return primary;
    }
}
