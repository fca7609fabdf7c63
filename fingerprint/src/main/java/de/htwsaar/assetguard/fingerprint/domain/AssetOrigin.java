package de.htwsaar.assetguard.fingerprint.domain;

/**
 * Herkunft eines Assets.
 *
 * <p>Stylesheets werden nur gegen Assets derselben Herkunft umgeschrieben:
 * Vendor-Stylesheets referenzieren Vendor-Bilder und -Fonts, Anwendungs-Stylesheets
 * werden nicht auf Vendor-Assets umgebogen.</p>
 */
public enum AssetOrigin {
    APPLICATION,
    VENDORED
}
