package com.nftindexer.ingestion.normalizer;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-pass counters, logged once the pass completes.
 */
public class NormalizationStats {

    private int received;
    private int ignored;
    private int decodeErrors;
    private int handlerErrors;
    private final Map<HandlerOutcome, Integer> outcomes = new EnumMap<>(HandlerOutcome.class);

    void received() {
        received++;
    }

    void ignored() {
        ignored++;
    }

    void decodeError() {
        decodeErrors++;
    }

    void handlerError() {
        handlerErrors++;
    }

    void outcome(HandlerOutcome outcome) {
        outcomes.merge(outcome, 1, Integer::sum);
    }

    public int getReceived() {
        return received;
    }

    public int getIgnored() {
        return ignored;
    }

    public int getDecodeErrors() {
        return decodeErrors;
    }

    public int getHandlerErrors() {
        return handlerErrors;
    }

    public int count(HandlerOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    @Override
    public String toString() {
        return "received=" + received + ", ignored=" + ignored + ", decodeErrors=" + decodeErrors
                + ", handlerErrors=" + handlerErrors + ", outcomes=" + outcomes;
    }
}
