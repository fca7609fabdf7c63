package de.htwsaar.assetguard.web.auth;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Beantwortet, ob ein Request zu einer angemeldeten Sitzung gehört.
 *
 * <p>Die Anmeldung selbst passiert außerhalb dieser Anwendung; hier wird nur das Ergebnis gelesen.</p>
 */
@FunctionalInterface
public interface AuthenticationProbe {

    boolean isAuthenticated(HttpServletRequest request);
}
