package com.nftindexer.ingestion.normalizer;

import com.nftindexer.domain.EventLog;
import com.nftindexer.domain.RawEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logs seen so far for the transaction being normalized. Cleared whenever the tx hash changes,
 * so handlers can look at sibling logs without re-fetching the receipt.
 */
public class TransactionLogCache {

    private String currentTxHash;
    private final List<EventLog> logs = new ArrayList<>();

    public void observe(RawEvent event) {
        if (!Objects.equals(currentTxHash, event.txHash())) {
            currentTxHash = event.txHash();
            logs.clear();
        }
        if (event.log() != null) {
            logs.add(event.log());
        }
    }

    public String getCurrentTxHash() {
        return currentTxHash;
    }

    public List<EventLog> logs() {
        return Collections.unmodifiableList(logs);
    }
}
