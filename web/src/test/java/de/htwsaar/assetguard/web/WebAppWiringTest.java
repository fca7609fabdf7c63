package de.htwsaar.assetguard.web;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetguard.common.auth.SecurityConfig;
import de.htwsaar.assetguard.common.logging.LoggingConfig;
import de.htwsaar.assetguard.web.cache.CacheConfigService;
import de.htwsaar.assetguard.web.cache.CacheRuntimeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Import;

/**
 * Verifiziert Verdrahtung und Filter-Reihenfolge der Web-Applikation.
 */
class WebAppWiringTest {

    @Test
    void shouldImportSharedConfigs() {
        Import importAnnotation = WebApp.class.getAnnotation(Import.class);
        assertNotNull(importAnnotation);
        assertArrayEquals(new Class<?>[] {LoggingConfig.class, SecurityConfig.class}, importAnnotation.value());
    }

    @Test
    void deferredLayersWrapAllWritingLayers() {
        assertTrue(WebBeans.ORDER_TRACE < WebBeans.ORDER_ADMIN_AUTH);
        assertTrue(WebBeans.ORDER_ADMIN_AUTH < WebBeans.ORDER_LEGACY_STRIP);
        assertTrue(WebBeans.ORDER_LEGACY_STRIP < WebBeans.ORDER_FINAL_OVERRIDE);
        assertTrue(WebBeans.ORDER_FINAL_OVERRIDE < WebBeans.ORDER_SECURITY_HEADERS);
        assertTrue(WebBeans.ORDER_SECURITY_HEADERS < WebBeans.ORDER_CACHE_POLICY);
    }

    @Test
    void pageMaxAgeFallsBackToDefaultMaxAge() {
        WebBeans beans = new WebBeans();
        CacheConfigService fallback = beans.cacheConfigService(
                604800, 86400, 1800, "", 60, true,
                CacheRuntimeConfig.DEFAULT_STATIC_OVERRIDE, CacheRuntimeConfig.DEFAULT_PAGE_OVERRIDE);
        assertEquals(1800, fallback.current().pageMaxAge());

        CacheConfigService explicit = beans.cacheConfigService(
                604800, 86400, 1800, " 900 ", 60, true, null, null);
        assertEquals(900, explicit.current().pageMaxAge());
        assertEquals(CacheRuntimeConfig.DEFAULT_PAGE_OVERRIDE, explicit.current().pageOverrideDirective());
    }
}
