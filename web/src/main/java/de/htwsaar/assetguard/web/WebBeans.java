package de.htwsaar.assetguard.web;

import de.htwsaar.assetguard.common.auth.AdminAuthFilter;
import de.htwsaar.assetguard.common.logging.TraceIdFilter;
import de.htwsaar.assetguard.fingerprint.discovery.AssetDiscovery;
import de.htwsaar.assetguard.fingerprint.discovery.AssetRoot;
import de.htwsaar.assetguard.fingerprint.domain.AssetOrigin;
import de.htwsaar.assetguard.fingerprint.manifest.ManifestStore;
import de.htwsaar.assetguard.fingerprint.pipeline.FingerprintPipeline;
import de.htwsaar.assetguard.fingerprint.resolve.AssetPathResolver;
import de.htwsaar.assetguard.fingerprint.rewrite.ReferenceRewriter;
import de.htwsaar.assetguard.web.assets.AssetRebuildService;
import de.htwsaar.assetguard.web.auth.AuthenticationProbe;
import de.htwsaar.assetguard.web.auth.PrincipalAuthenticationProbe;
import de.htwsaar.assetguard.web.cache.CacheConfigService;
import de.htwsaar.assetguard.web.cache.CachePolicyEngine;
import de.htwsaar.assetguard.web.cache.CachePolicyFilter;
import de.htwsaar.assetguard.web.cache.CacheRuntimeConfig;
import de.htwsaar.assetguard.web.cache.DeploymentEnvironment;
import de.htwsaar.assetguard.web.headers.FinalCacheOverride;
import de.htwsaar.assetguard.web.headers.HeaderGuardFilter;
import de.htwsaar.assetguard.web.headers.LegacyHeaderStripper;
import de.htwsaar.assetguard.web.headers.SecurityHeadersFilter;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import jakarta.servlet.Filter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.env.Environment;

/**
 * Zentrale Spring-Verdrahtung der Web-Komponenten.
 *
 * <p>Filter-Reihenfolge (außen nach innen): Trace-Id → Admin-Token → Legacy-Header-Stripper →
 * Final-Override → Security-Header → Cache-Policy. Stripper und Override entscheiden erst beim Commit,
 * alle inneren Schichten schreiben also vor ihnen.</p>
 */
@Configuration
public class WebBeans {

    static final int ORDER_TRACE = Ordered.HIGHEST_PRECEDENCE;
    static final int ORDER_ADMIN_AUTH = Ordered.HIGHEST_PRECEDENCE + 10;
    static final int ORDER_LEGACY_STRIP = Ordered.HIGHEST_PRECEDENCE + 20;
    static final int ORDER_FINAL_OVERRIDE = Ordered.HIGHEST_PRECEDENCE + 30;
    static final int ORDER_SECURITY_HEADERS = Ordered.HIGHEST_PRECEDENCE + 40;
    static final int ORDER_CACHE_POLICY = Ordered.HIGHEST_PRECEDENCE + 50;

    /**
     * Systemuhr für Build-Zeitstempel.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RouteClassifier routeClassifier() {
        return new RouteClassifier();
    }

    /**
     * Umgebungsname aus {@code assetguard.environment}, Standard {@code production}.
     */
    @Bean
    public DeploymentEnvironment deploymentEnvironment(Environment env) {
        return () -> env.getProperty("assetguard.environment", DeploymentEnvironment.PRODUCTION);
    }

    @Bean
    public AuthenticationProbe authenticationProbe() {
        return new PrincipalAuthenticationProbe();
    }

    /**
     * Initialisiert die live-änderbare Cache-Konfiguration aus den Properties.
     *
     * @param staticMaxAge       max-age statischer Assets (Standard: 604800)
     * @param staticSwr          stale-while-revalidate statischer Assets (Standard: 86400)
     * @param defaultMaxAge      globales max-age (Standard: 3600)
     * @param pageMaxAge         max-age für Seiten, leer = {@code defaultMaxAge}
     * @param pageSwr            stale-while-revalidate für Seiten (Standard: 60)
     * @param overrideEnabled    Final-Override aktiv (Standard: true)
     * @param staticOverride     finale Direktive für statische Assets
     * @param pageOverride       finale Direktive für Seiten
     * @return initialisierter {@link CacheConfigService}
     */
    @Bean
    public CacheConfigService cacheConfigService(
            @Value("${assetguard.cache.static.max-age:604800}") long staticMaxAge,
            @Value("${assetguard.cache.static.stale-while-revalidate:86400}") long staticSwr,
            @Value("${assetguard.cache.default-max-age:3600}") long defaultMaxAge,
            @Value("${assetguard.cache.page.max-age:}") String pageMaxAge,
            @Value("${assetguard.cache.page.stale-while-revalidate:60}") long pageSwr,
            @Value("${assetguard.cache.override.enabled:true}") boolean overrideEnabled,
            @Value("${assetguard.cache.override.static-directive:" + CacheRuntimeConfig.DEFAULT_STATIC_OVERRIDE + "}")
                    String staticOverride,
            @Value("${assetguard.cache.override.page-directive:" + CacheRuntimeConfig.DEFAULT_PAGE_OVERRIDE + "}")
                    String pageOverride) {

        long page = pageMaxAge == null || pageMaxAge.isBlank() ? defaultMaxAge : Long.parseLong(pageMaxAge.trim());
        return new CacheConfigService(new CacheRuntimeConfig(
                staticMaxAge, staticSwr, page, pageSwr, overrideEnabled, staticOverride, pageOverride));
    }

    @Bean
    public CachePolicyEngine cachePolicyEngine(
            RouteClassifier routeClassifier, CacheConfigService cacheConfigService, DeploymentEnvironment env) {
        return new CachePolicyEngine(routeClassifier, cacheConfigService, env);
    }

    // ---------- Assets ----------

    /**
     * Manifest-Store der Laufzeit; Rebuild und Resolver teilen sich diese Instanz.
     *
     * @param outputDir        Output-Verzeichnis (Standard: "public")
     * @param manifestFile     Artefakt, leer = {@code <outputDir>/asset-manifest.json}
     * @param dropStaleEntries Einträge ohne Datei beim Laden verwerfen (Standard: true)
     */
    @Bean
    public ManifestStore manifestStore(
            @Value("${assetguard.assets.output-dir:public}") String outputDir,
            @Value("${assetguard.assets.manifest-file:}") String manifestFile,
            @Value("${assetguard.assets.drop-stale-entries:true}") boolean dropStaleEntries) {

        Path out = Path.of(outputDir);
        Path file = manifestFile == null || manifestFile.isBlank()
                ? out.resolve(ManifestStore.DEFAULT_FILE_NAME)
                : Path.of(manifestFile);
        return new ManifestStore(file, dropStaleEntries ? out : null);
    }

    @Bean
    public AssetPathResolver assetPathResolver(ManifestStore manifestStore) {
        return new AssetPathResolver(manifestStore);
    }

    @Bean
    public FingerprintPipeline fingerprintPipeline(
            ManifestStore manifestStore, Clock clock, @Value("${assetguard.assets.output-dir:public}") String outputDir) {
        return new FingerprintPipeline(
                new AssetDiscovery(), manifestStore, new ReferenceRewriter(), Path.of(outputDir), clock);
    }

    /**
     * @param appRoots    Anwendungs-Roots, kommasepariert als {@code DIR} oder {@code DIR=PREFIX}
     * @param vendorRoots Vendor-Roots im selben Format
     */
    @Bean
    public AssetRebuildService assetRebuildService(
            FingerprintPipeline fingerprintPipeline,
            @Value("${assetguard.assets.app-roots:}") List<String> appRoots,
            @Value("${assetguard.assets.vendor-roots:}") List<String> vendorRoots) {

        List<AssetRoot> roots = new ArrayList<>();
        appRoots.stream().filter(s -> !s.isBlank()).forEach(s -> roots.add(AssetRoot.parse(s, AssetOrigin.APPLICATION)));
        vendorRoots.stream().filter(s -> !s.isBlank()).forEach(s -> roots.add(AssetRoot.parse(s, AssetOrigin.VENDORED)));
        return new AssetRebuildService(fingerprintPipeline, roots);
    }

    // ---------- Filter ----------

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration(TraceIdFilter traceIdFilter) {
        return registration(traceIdFilter, ORDER_TRACE);
    }

    @Bean
    public FilterRegistrationBean<AdminAuthFilter> adminAuthFilterRegistration(AdminAuthFilter adminAuthFilter) {
        return registration(adminAuthFilter, ORDER_ADMIN_AUTH);
    }

    @Bean
    public FilterRegistrationBean<HeaderGuardFilter> legacyHeaderStripFilter(RouteClassifier routeClassifier) {
        return registration(new HeaderGuardFilter(new LegacyHeaderStripper(routeClassifier)), ORDER_LEGACY_STRIP);
    }

    @Bean
    public FilterRegistrationBean<HeaderGuardFilter> finalCacheOverrideFilter(
            CachePolicyEngine cachePolicyEngine, AuthenticationProbe authenticationProbe) {
        return registration(
                new HeaderGuardFilter(new FinalCacheOverride(cachePolicyEngine, authenticationProbe)),
                ORDER_FINAL_OVERRIDE);
    }

    @Bean
    public FilterRegistrationBean<SecurityHeadersFilter> securityHeadersFilter(
            @Value("${assetguard.security-headers.enabled:true}") boolean enabled) {
        FilterRegistrationBean<SecurityHeadersFilter> bean =
                registration(new SecurityHeadersFilter(), ORDER_SECURITY_HEADERS);
        bean.setEnabled(enabled);
        return bean;
    }

    @Bean
    public FilterRegistrationBean<CachePolicyFilter> cachePolicyFilter(
            CachePolicyEngine cachePolicyEngine, AuthenticationProbe authenticationProbe) {
        return registration(new CachePolicyFilter(cachePolicyEngine, authenticationProbe), ORDER_CACHE_POLICY);
    }

    private static <T extends Filter> FilterRegistrationBean<T> registration(T filter, int order) {
        FilterRegistrationBean<T> bean = new FilterRegistrationBean<>(filter);
        bean.setOrder(order);
        bean.addUrlPatterns("/*");
        return bean;
    }
}
