package com.nftindexer.ingestion.normalizer;

/**
 * What a handler did with one decoded event.
 */
public enum HandlerOutcome {
    APPLIED,
    /** Shape the indexer deliberately does not settle (multi-item bundles). Not an error. */
    SKIPPED_UNSUPPORTED,
    /** No native price could be resolved; nothing derived from the event is kept. */
    SKIPPED_PRICE_UNAVAILABLE,
    /** Decoded values break an invariant (zero amount, empty list). */
    SKIPPED_INVALID
}
