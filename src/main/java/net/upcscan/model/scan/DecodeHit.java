package net.upcscan.model.scan;

/**
 * A single symbol reported by the symbol decoder.
 *
 * @param symbology the symbology the decoder recognised
 * @param payload the decoded digits, as reported by the decoder
 */
public record DecodeHit(Symbology symbology, String payload) {

    public DecodeHit {
        if (symbology == null) {
            throw new IllegalArgumentException("symbology must not be null");
        }
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload must not be blank");
        }
    }
}
