package de.htwsaar.assetguard.web;

import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Liefert das Output-Verzeichnis des Fingerprint-Laufs als statische Dateien aus.
 *
 * <p>Niedrigste Handler-Priorität, damit Controller immer Vorrang haben. Cache-Header kommen ausschließlich
 * aus Policy-Filter und Final-Override.</p>
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final String outputDir;

    public StaticResourceConfig(@Value("${assetguard.assets.output-dir:public}") String outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(outputDir).toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.setOrder(Ordered.LOWEST_PRECEDENCE);
        registry.addResourceHandler("/**").addResourceLocations(location);
    }
}
