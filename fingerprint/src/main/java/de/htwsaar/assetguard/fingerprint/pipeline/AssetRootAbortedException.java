package de.htwsaar.assetguard.fingerprint.pipeline;

import java.nio.file.Path;

/**
 * Ein Anwendungs-Asset konnte nicht gelesen werden; der betroffene Root wird komplett übersprungen.
 */
public class AssetRootAbortedException extends RuntimeException {

    private final Path root;

    public AssetRootAbortedException(Path root, String message, Throwable cause) {
        super(message, cause);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
