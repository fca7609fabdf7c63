package de.htwsaar.assetguard.web.headers;

import de.htwsaar.assetguard.common.util.PathUtils;
import de.htwsaar.assetguard.web.auth.AuthenticationProbe;
import de.htwsaar.assetguard.web.cache.CacheDecision;
import de.htwsaar.assetguard.web.cache.CachePolicyEngine;
import de.htwsaar.assetguard.web.cache.CacheRuntimeConfig;
import de.htwsaar.assetguard.web.route.RouteClass;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Letzte Schicht: setzt {@code Cache-Control} und {@code Vary} für statische Assets und HTML-Seiten
 * unmittelbar vor dem Commit und sperrt beide Header danach.
 *
 * <p>Ausnahmen: API/Health, die Startseite {@code /}, andere Methoden als {@code GET}/{@code HEAD},
 * deaktivierter Override, authentifizierte Seitenaufrufe und Fehlerstatus ab 400.</p>
 */
public class FinalCacheOverride implements HeaderGuard {

    private final CachePolicyEngine engine;
    private final AuthenticationProbe authenticationProbe;

    public FinalCacheOverride(CachePolicyEngine engine, AuthenticationProbe authenticationProbe) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.authenticationProbe = Objects.requireNonNull(authenticationProbe, "authenticationProbe must not be null");
    }

    @Override
    public void register(HttpServletRequest request, HeaderGuardResponseWrapper response) {
        if (!CachePolicyEngine.isSafeRead(request.getMethod())) {
            return;
        }
        if (isRoot(RouteClassifier.pathWithinApplication(request))) {
            return;
        }
        RouteClass route = engine.classifier().classify(request);
        if (route != RouteClass.STATIC_ASSET && route != RouteClass.HTML_PAGE) {
            return;
        }
        response.onBeforeCommit(() -> {
            if (response.getStatus() >= 400) {
                return;
            }
            String directive = directiveFor(route, () -> authenticationProbe.isAuthenticated(request));
            if (directive != null) {
                response.setHeaderAndLock(CacheDecision.CACHE_CONTROL, directive);
                response.setHeaderAndLock(CacheDecision.VARY, CacheDecision.VARY_ACCEPT_ENCODING);
            }
        });
    }

    /**
     * @param method        HTTP-Methode
     * @param path          Pfad innerhalb der Anwendung
     * @param authenticated Authentifizierungs-Prädikat
     * @return finaler {@code Cache-Control}-Wert oder {@code null}, wenn nicht überschrieben wird
     */
    public String directiveFor(String method, String path, BooleanSupplier authenticated) {
        if (!CachePolicyEngine.isSafeRead(method) || isRoot(path)) {
            return null;
        }
        return directiveFor(engine.classifier().classify(path), authenticated);
    }

    // die Startseite behält die Seiten-Policy der Engine
    static boolean isRoot(String path) {
        return PathUtils.toLogicalPath(PathUtils.stripQueryAndFragment(path)).isEmpty();
    }

    private String directiveFor(RouteClass route, BooleanSupplier authenticated) {
        CacheRuntimeConfig config = engine.currentConfig();
        if (!config.overrideEnabled()) {
            return null;
        }
        if (route == RouteClass.STATIC_ASSET) {
            return config.staticOverrideDirective();
        }
        if (route == RouteClass.HTML_PAGE && !engine.isAuthenticated(authenticated)) {
            return config.pageOverrideDirective();
        }
        return null;
    }
}
