package de.htwsaar.assetguard.web.cache;

import de.htwsaar.assetguard.web.route.RouteClass;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entscheidet pro Request, welche Cache-Header gesetzt werden.
 *
 * <p>Reihenfolge, erste passende Regel gewinnt:</p>
 * <ol>
 *   <li>kein {@code GET}/{@code HEAD} → keine Policy</li>
 *   <li>API- oder Health-Route → keine Policy</li>
 *   <li>Umgebung {@code development} → no-store</li>
 *   <li>authentifiziert → keine Policy</li>
 *   <li>statisches Asset → Static-Policy</li>
 *   <li>sonst → Seiten-Policy</li>
 * </ol>
 *
 * <p>Fehler beim Lesen von Umgebung, Konfiguration oder Authentifizierung führen nie zu einer
 * Exception, sondern zu den sicheren Standardwerten.</p>
 */
public class CachePolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(CachePolicyEngine.class);

    private final RouteClassifier classifier;
    private final CacheConfigService configService;
    private final DeploymentEnvironment environment;

    public CachePolicyEngine(
            RouteClassifier classifier, CacheConfigService configService, DeploymentEnvironment environment) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * @param method        HTTP-Methode
     * @param path          Pfad innerhalb der Anwendung
     * @param authenticated Authentifizierungs-Prädikat, darf {@code null} sein
     * @return Entscheidung, nie {@code null}
     */
    public CacheDecision decide(String method, String path, BooleanSupplier authenticated) {
        if (!isSafeRead(method)) {
            return CacheDecision.noPolicy();
        }
        RouteClass route = classifier.classify(path);
        if (route == RouteClass.API || route == RouteClass.HEALTH) {
            return CacheDecision.noPolicy();
        }
        if (isDevelopment()) {
            return CacheDecision.noStore();
        }
        if (isAuthenticated(authenticated)) {
            return CacheDecision.noPolicy();
        }
        CacheRuntimeConfig config = currentConfig();
        if (route == RouteClass.STATIC_ASSET) {
            return CacheDecision.staticAsset(config.staticMaxAge(), config.staticStaleWhileRevalidate());
        }
        return CacheDecision.page(config.pageMaxAge(), config.pageStaleWhileRevalidate());
    }

    /**
     * @param method HTTP-Methode
     * @return {@code true} für {@code GET} und {@code HEAD}
     */
    public static boolean isSafeRead(String method) {
        return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
    }

    /** @return {@code true}, wenn die Umgebung {@code development} ist; Lesefehler zählen als production */
    public boolean isDevelopment() {
        try {
            return DeploymentEnvironment.isDevelopment(environment.name());
        } catch (RuntimeException e) {
            log.warn("Environment lookup failed, assuming {}", DeploymentEnvironment.PRODUCTION, e);
            return false;
        }
    }

    /** @return aktuelle Konfiguration oder {@link CacheRuntimeConfig#DEFAULTS} bei Fehlern */
    public CacheRuntimeConfig currentConfig() {
        try {
            CacheRuntimeConfig config = configService.current();
            return config != null ? config : CacheRuntimeConfig.DEFAULTS;
        } catch (RuntimeException e) {
            log.warn("Cache configuration lookup failed, using defaults", e);
            return CacheRuntimeConfig.DEFAULTS;
        }
    }

    /**
     * @param authenticated Prädikat oder {@code null}
     * @return Ergebnis des Prädikats; fehlend oder werfend gilt als nicht authentifiziert
     */
    public boolean isAuthenticated(BooleanSupplier authenticated) {
        if (authenticated == null) {
            return false;
        }
        try {
            return authenticated.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Authentication check failed, treating request as anonymous", e);
            return false;
        }
    }

    public RouteClassifier classifier() {
        return classifier;
    }
}
