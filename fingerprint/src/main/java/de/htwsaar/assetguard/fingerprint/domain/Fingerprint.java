package de.htwsaar.assetguard.fingerprint.domain;

import de.htwsaar.assetguard.common.util.ContentHasher;
import java.util.regex.Pattern;

/**
 * Inhalts-Fingerprint: genau 8 Hex-Zeichen in Kleinbuchstaben.
 *
 * @param value Hex-Wert
 */
public record Fingerprint(String value) {

    private static final Pattern FORMAT = Pattern.compile("[0-9a-f]{" + ContentHasher.FINGERPRINT_LENGTH + "}");

    public Fingerprint {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new FingerprintException("Invalid fingerprint: '" + value + "'");
        }
    }

    /**
     * Berechnet den Fingerprint eines Byte-Inhalts.
     *
     * @param content Inhalt
     * @return Fingerprint
     */
    public static Fingerprint of(byte[] content) {
        return new Fingerprint(ContentHasher.fingerprint(content));
    }

    @Override
    public String toString() {
        return value;
    }
}
