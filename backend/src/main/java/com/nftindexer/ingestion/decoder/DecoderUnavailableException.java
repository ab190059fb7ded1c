package com.nftindexer.ingestion.decoder;

/**
 * Thrown when no decoder is wired for an event kind the engine dispatches. Integration error, not a data
 * error: it aborts the batch and reaches the caller.
 */
public class DecoderUnavailableException extends RuntimeException {

    public DecoderUnavailableException(String message) {
        super(message);
    }
}
