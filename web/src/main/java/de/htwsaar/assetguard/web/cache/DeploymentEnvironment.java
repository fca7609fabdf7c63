package de.htwsaar.assetguard.web.cache;

/**
 * Liefert den Namen der Laufzeitumgebung ({@code development}, {@code production}, ...).
 */
@FunctionalInterface
public interface DeploymentEnvironment {

    String DEVELOPMENT = "development";
    String PRODUCTION = "production";

    /** @return Umgebungsname; {@code null} oder leer gilt als {@code production} */
    String name();

    /**
     * @param name Umgebungsname
     * @return {@code true} nur für {@code development} (Groß-/Kleinschreibung egal)
     */
    static boolean isDevelopment(String name) {
        return name != null && DEVELOPMENT.equalsIgnoreCase(name.trim());
    }
}
