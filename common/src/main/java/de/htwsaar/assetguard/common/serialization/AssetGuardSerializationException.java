package de.htwsaar.assetguard.common.serialization;

public class AssetGuardSerializationException extends RuntimeException {

    public AssetGuardSerializationException(String message) {

        super(message);
    }

    public AssetGuardSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
