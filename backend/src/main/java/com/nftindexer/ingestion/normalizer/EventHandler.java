package com.nftindexer.ingestion.normalizer;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.decoder.DecodedEvent;

import java.util.Set;

/**
 * Settlement rule for one or more event kinds. Implementations append to {@code out} only after every check
 * has passed, so a skipped event leaves no partial records behind.
 */
public interface EventHandler {

    Set<EventKind> kinds();

    HandlerOutcome handle(RawEvent event, DecodedEvent decoded, TransactionLogCache txLogs, OnChainData out);
}
