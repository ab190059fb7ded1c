package com.nftindexer.domain;

import java.util.List;

/**
 * A single EVM log entry as delivered by the upstream log fetcher.
 *
 * @param address  emitting contract
 * @param topics   topic0 (event signature hash) followed by indexed arguments
 * @param data     0x-prefixed hex of the non-indexed arguments
 * @param logIndex position of the log within its block
 */
public record EventLog(String address, List<String> topics, String data, int logIndex) {

    public EventLog {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public String topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
