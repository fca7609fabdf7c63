package de.htwsaar.assetguard.common.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Inhaltsbasierte Hash-Funktionen für Asset-Fingerprints.
 *
 * <p>Der Fingerprint ist eine reine Funktion der Bytes: gleicher Inhalt ergibt immer denselben
 * Wert, unabhängig von Pfad, Änderungszeitpunkt oder Prozess.</p>
 */
public final class ContentHasher {

    /** Länge eines Fingerprints in Hex-Zeichen. */
    public static final int FINGERPRINT_LENGTH = 8;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHasher() {}

    /**
     * Berechnet den kurzen Fingerprint (erste 8 Hex-Zeichen des SHA-256-Digests).
     *
     * @param data Datei-Bytes (darf nicht {@code null} sein)
     * @return 8 Zeichen, Kleinbuchstaben-Hex
     */
    public static String fingerprint(byte[] data) {
        return sha256Hex(data).substring(0, FINGERPRINT_LENGTH);
    }

    /**
     * Berechnet den vollständigen SHA-256-Digest als Hex-String.
     *
     * @param data Datei-Bytes (darf nicht {@code null} sein)
     * @return 64 Zeichen, Kleinbuchstaben-Hex
     */
    public static String sha256Hex(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute SHA-256", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.toString();
    }
}
