package de.htwsaar.offlinecache.common.serialization;

public class OfflineCacheSerializationException extends RuntimeException {

    public OfflineCacheSerializationException(String message) {

        super(message);
    }

    public OfflineCacheSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
