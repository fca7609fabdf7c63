package de.htwsaar.assetguard.web.api;

import de.htwsaar.assetguard.web.cache.CacheConfigService;
import de.htwsaar.assetguard.web.cache.CacheRuntimeConfig;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-API für die Live-Konfiguration der Cache-Policy.
 *
 * <ul>
 *   <li>GET   /api/admin/cache/config – aktuelle Konfiguration</li>
 *   <li>PUT   /api/admin/cache/config – vollständiges Update</li>
 *   <li>PATCH /api/admin/cache/config – partielles Update</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin/cache/config")
public class CacheAdminConfigController {

    private final CacheConfigService configService;

    public CacheAdminConfigController(CacheConfigService configService) {
        this.configService = configService;
    }

    /** @return aktuelle {@link CacheRuntimeConfig} */
    @GetMapping
    public ResponseEntity<CacheRuntimeConfig> getConfig() {
        return ResponseEntity.ok(configService.current());
    }

    /**
     * Vollständiges Update; negative Werte werden auf 0 gesetzt, leere Direktiven auf den Standard.
     *
     * @param next neue Konfiguration
     * @return gespeicherte Konfiguration
     */
    @PutMapping
    public ResponseEntity<CacheRuntimeConfig> updateConfig(@RequestBody CacheRuntimeConfig next) {
        configService.update(next);
        return ResponseEntity.ok(configService.current());
    }

    /**
     * Partielles Update (nur gesetzte Felder werden übernommen).
     *
     * @param dto Felder können {@code null} sein
     * @return aktualisierte Konfiguration
     */
    @PatchMapping
    public ResponseEntity<CacheRuntimeConfig> patchConfig(@RequestBody ConfigPatchDto dto) {
        return ResponseEntity.ok(configService.patch(
                dto.staticMaxAge(),
                dto.staticStaleWhileRevalidate(),
                dto.pageMaxAge(),
                dto.pageStaleWhileRevalidate(),
                dto.overrideEnabled(),
                dto.staticOverrideDirective(),
                dto.pageOverrideDirective()));
    }

    /**
     * DTO für partielles Update (alle Felder optional).
     */
    public record ConfigPatchDto(
            Long staticMaxAge,
            Long staticStaleWhileRevalidate,
            Long pageMaxAge,
            Long pageStaleWhileRevalidate,
            Boolean overrideEnabled,
            String staticOverrideDirective,
            String pageOverrideDirective) {}
}
