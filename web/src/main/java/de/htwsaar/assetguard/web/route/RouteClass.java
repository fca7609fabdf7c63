package de.htwsaar.assetguard.web.route;

/**
 * Klassifikation eines Request-Pfads für Cache-Policy, Header-Stripping und Final-Override.
 */
public enum RouteClass {
    API,
    HEALTH,
    STATIC_ASSET,
    HTML_PAGE,
    OTHER
}
