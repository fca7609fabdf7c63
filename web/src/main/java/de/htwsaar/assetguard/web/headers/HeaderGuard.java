package de.htwsaar.assetguard.web.headers;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Schicht, die ihre Header-Entscheidung unmittelbar vor dem Commit trifft.
 */
@FunctionalInterface
public interface HeaderGuard {

    /**
     * Wird vor der Weiterverarbeitung aufgerufen; verzögerte Arbeit wird über
     * {@link HeaderGuardResponseWrapper#onBeforeCommit(Runnable)} registriert.
     *
     * @param request  Request
     * @param response Wrapper der aktuellen Response
     */
    void register(HttpServletRequest request, HeaderGuardResponseWrapper response);
}
