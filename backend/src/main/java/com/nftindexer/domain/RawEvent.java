package com.nftindexer.domain;

/**
 * Filtered log handed to the normalization engine, tagged with its kind by the upstream filter.
 * The kind is kept as the wire tag so that kinds this build does not know about are ignored rather than rejected.
 */
public record RawEvent(String kind, OriginParams originParams, EventLog log) {

    public RawEvent(EventKind kind, OriginParams originParams, EventLog log) {
        this(kind.getTag(), originParams, log);
    }

    public String txHash() {
        return originParams == null ? null : originParams.txHash();
    }
}
