package de.htwsaar.assetguard.web.assets;

/**
 * Ein Fingerprint-Lauf ist bereits aktiv.
 */
public class RebuildInProgressException extends RuntimeException {

    public RebuildInProgressException() {
        super("Asset rebuild already in progress");
    }
}
