package com.nftindexer.domain;

/**
 * @param txTimestamp epoch seconds
 */
public record Trigger(TriggerKind kind, String txHash, long txTimestamp) {
}
