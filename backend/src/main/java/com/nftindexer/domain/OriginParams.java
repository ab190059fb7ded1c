package com.nftindexer.domain;

/**
 * Position of a canonical record on chain. {@code (txHash, logIndex, batchIndex)} is the idempotency key
 * downstream; batchIndex tells apart several records derived from one log.
 *
 * @param timestamp block timestamp in epoch seconds
 */
public record OriginParams(
        String txHash,
        String blockHash,
        long block,
        int logIndex,
        int batchIndex,
        long timestamp,
        String contractAddress
) {

    public OriginParams withBatchIndex(int newBatchIndex) {
        return new OriginParams(txHash, blockHash, block, logIndex, newBatchIndex, timestamp, contractAddress);
    }

    /** Deterministic id used as the document key by the persistence sink. */
    public String eventId() {
        return txHash + "-" + logIndex + "-" + batchIndex;
    }
}
