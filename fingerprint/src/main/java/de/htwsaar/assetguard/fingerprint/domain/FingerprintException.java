package de.htwsaar.assetguard.fingerprint.domain;

/**
 * Fachliche Exception des Build-Laufs (ungültiger Fingerprint, Schreibfehler im Output).
 */
public class FingerprintException extends RuntimeException {

    public FingerprintException(String message) {
        super(message);
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
