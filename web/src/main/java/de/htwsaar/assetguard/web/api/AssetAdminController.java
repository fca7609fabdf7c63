package de.htwsaar.assetguard.web.api;

import de.htwsaar.assetguard.fingerprint.domain.FingerprintException;
import de.htwsaar.assetguard.fingerprint.manifest.AssetManifest;
import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import de.htwsaar.assetguard.fingerprint.pipeline.FingerprintReport;
import de.htwsaar.assetguard.web.assets.AssetRebuildService;
import de.htwsaar.assetguard.web.assets.RebuildInProgressException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-API für Manifest und Fingerprint-Läufe.
 *
 * <ul>
 *   <li>GET  /api/admin/assets/manifest         – geladenes Manifest</li>
 *   <li>POST /api/admin/assets/manifest/reload  – Artefakt neu lesen</li>
 *   <li>POST /api/admin/assets/fingerprint      – Assets neu bauen (409 bei laufendem Build)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin/assets")
public class AssetAdminController {

    private static final Logger log = LoggerFactory.getLogger(AssetAdminController.class);

    private final ManifestStore manifestStore;
    private final AssetRebuildService rebuildService;

    public AssetAdminController(ManifestStore manifestStore, AssetRebuildService rebuildService) {
        this.manifestStore = manifestStore;
        this.rebuildService = rebuildService;
    }

    /** @return Artefakt-Pfad, Anzahl und Einträge */
    @GetMapping("/manifest")
    public ResponseEntity<Map<String, Object>> manifest() {
        return ResponseEntity.ok(describe(manifestStore.load()));
    }

    /** @return neu geladenes Manifest */
    @PostMapping("/manifest/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        manifestStore.invalidate();
        return ResponseEntity.ok(describe(manifestStore.load()));
    }

    /** @return Bericht des Laufs, 409 wenn bereits ein Lauf aktiv ist, 500 bei Schreibfehlern */
    @PostMapping("/fingerprint")
    public ResponseEntity<Map<String, Object>> fingerprint() {
        try {
            FingerprintReport report = rebuildService.rebuild();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("successful", report.successful());
            body.put("fingerprinted", report.fingerprinted());
            body.put("rewrittenStylesheets", report.rewrittenStylesheets());
            body.put("copied", report.copied());
            body.put("skipped", report.skipped());
            body.put("failedRoots", report.failedRoots());
            body.put("manifestFile", report.manifestFile().toString());
            body.put("startedAt", report.startedAt().toString());
            body.put("durationMs", report.duration().toMillis());
            return ResponseEntity.ok(body);
        } catch (RebuildInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (FingerprintException e) {
            log.error("Asset rebuild failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    private Map<String, Object> describe(AssetManifest manifest) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("manifestFile", manifestStore.manifestFile().toString());
        body.put("size", manifest.size());
        body.put("entries", manifest.entries());
        return body;
    }
}
