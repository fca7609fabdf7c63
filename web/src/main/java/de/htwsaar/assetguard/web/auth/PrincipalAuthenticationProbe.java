package de.htwsaar.assetguard.web.auth;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Standard-Probe: angemeldet ist, wer einen Servlet-Principal trägt.
 */
public class PrincipalAuthenticationProbe implements AuthenticationProbe {

    @Override
    public boolean isAuthenticated(HttpServletRequest request) {
        return request.getUserPrincipal() != null;
    }
}
