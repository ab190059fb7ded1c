package com.nftindexer.ingestion.decoder;

/**
 * Thrown when a log payload does not match the layout of its declared event kind.
 * Data error: the engine logs it and skips the single raw event.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
