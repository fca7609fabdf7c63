package de.htwsaar.assetguard.fingerprint.domain;

import java.util.Objects;

/**
 * Dateiname mit eingefügtem Fingerprint vor dem letzten Endungssegment.
 *
 * <ul>
 *   <li>{@code app.min.js} → {@code app.min.<fp>.js}</li>
 *   <li>{@code script} → {@code script.<fp>}</li>
 *   <li>{@code .htaccess} → {@code .htaccess.<fp>} (Punktdateien gelten als endungslos)</li>
 * </ul>
 *
 * @param original     ursprünglicher Dateiname (ohne Verzeichnis)
 * @param fingerprinted Dateiname mit Fingerprint
 */
public record FingerprintedName(String original, String fingerprinted) {

    public FingerprintedName {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(fingerprinted, "fingerprinted must not be null");
        if (original.equals(fingerprinted)) {
            throw new FingerprintException("Fingerprinted name equals original name: " + original);
        }
    }

    /**
     * Erzeugt den Namen für eine Datei.
     *
     * @param fileName    Dateiname ohne Verzeichnisanteil
     * @param fingerprint Fingerprint des Inhalts
     * @return Paar aus Original- und Fingerprint-Namen
     * @throws FingerprintException bei leerem Namen oder leerem Fingerprint
     */
    public static FingerprintedName of(String fileName, Fingerprint fingerprint) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/")) {
            throw new FingerprintException("Invalid file name: '" + fileName + "'");
        }
        if (fingerprint == null) {
            throw new FingerprintException("Missing fingerprint for " + fileName);
        }
        int dot = fileName.lastIndexOf('.');
        String name;
        if (dot <= 0 || dot == fileName.length() - 1) {
            name = fileName + "." + fingerprint.value();
        } else {
            name = fileName.substring(0, dot) + "." + fingerprint.value() + fileName.substring(dot);
        }
        return new FingerprintedName(fileName, name);
    }

    /**
     * Ersetzt im logischen Pfad das letzte Segment durch den Fingerprint-Namen.
     *
     * @param logicalPath logischer Pfad, dessen letztes Segment {@link #original()} ist
     * @return logischer Fingerprint-Pfad
     */
    public String applyTo(String logicalPath) {
        int slash = logicalPath.lastIndexOf('/');
        return slash >= 0 ? logicalPath.substring(0, slash + 1) + fingerprinted : fingerprinted;
    }
}
