package de.htwsaar.assetguard.web.api;

import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health- und Readiness-Probes. Beide Pfade bekommen nie Cache-Header.
 */
@RestController
@RequestMapping("/health")
public class ProbeController {

    private final ManifestStore manifestStore;

    public ProbeController(ManifestStore manifestStore) {
        this.manifestStore = manifestStore;
    }

    /** @return HTTP 200 "ok" */
    @GetMapping
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Bereit ist die Anwendung immer; ein leeres Manifest bedeutet nur, dass logische Pfade ausgeliefert werden.
     *
     * @return Status und Anzahl der Manifest-Einträge
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        return ResponseEntity.ok(Map.of("status", "ready", "manifestEntries", manifestStore.load().size()));
    }
}
