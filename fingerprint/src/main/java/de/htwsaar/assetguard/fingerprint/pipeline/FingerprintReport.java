package de.htwsaar.assetguard.fingerprint.pipeline;

import de.htwsaar.assetguard.fingerprint.manifest.AssetManifest;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Ergebnis eines Fingerprint-Laufs.
 *
 * @param fingerprinted        Anzahl gefingerprinteter Dateien
 * @param rewrittenStylesheets Anzahl Stylesheets, deren Inhalt sich durch Umschreiben geändert hat
 * @param copied               Anzahl unverändert kopierter Dateien (Passthrough)
 * @param skipped              Anzahl übersprungener, nicht lesbarer Vendor-Dateien
 * @param failedRoots          abgebrochene Roots mit Grund
 * @param manifestFile         geschriebenes Artefakt
 * @param manifest             geschriebener Inhalt
 * @param startedAt            Start
 * @param finishedAt           Ende
 */
public record FingerprintReport(
        int fingerprinted,
        int rewrittenStylesheets,
        int copied,
        int skipped,
        List<String> failedRoots,
        Path manifestFile,
        AssetManifest manifest,
        Instant startedAt,
        Instant finishedAt) {

    public FingerprintReport {
        failedRoots = failedRoots == null ? List.of() : List.copyOf(failedRoots);
    }

    public boolean successful() {
        return failedRoots.isEmpty();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
