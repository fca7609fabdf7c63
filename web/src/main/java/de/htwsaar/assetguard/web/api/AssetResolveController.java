package de.htwsaar.assetguard.web.api;

import de.htwsaar.assetguard.fingerprint.resolve.AssetPathResolver;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Öffentlicher Lookup logischer Asset-Pfade, z. B. für Templates außerhalb dieser Anwendung.
 */
@RestController
@RequestMapping("/api/assets")
public class AssetResolveController {

    private final AssetPathResolver resolver;

    public AssetResolveController(AssetPathResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param path logischer Pfad, z. B. {@code css/app.css}
     * @return {@code {"path": ..., "resolved": ...}}
     */
    @GetMapping("/resolve")
    public ResponseEntity<Map<String, String>> resolve(@RequestParam("path") String path) {
        if (path.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "path must not be blank"));
        }
        return ResponseEntity.ok(Map.of("path", path, "resolved", resolver.resolve(path)));
    }
}
