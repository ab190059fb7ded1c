package com.nftindexer.ingestion.normalizer.handler;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.NonceCancelEvent;
import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.OrderKind;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.decoder.DecodedEvent;
import com.nftindexer.ingestion.normalizer.EventHandler;
import com.nftindexer.ingestion.normalizer.HandlerOutcome;
import com.nftindexer.ingestion.normalizer.TransactionLogCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit nonce cancellations, one record per listed nonce in list order. Batch indexes restart at 1 for
 * every raw event, matching keys already persisted by earlier runs.
 */
@Component
@Slf4j
public class NonceCancellationHandler implements EventHandler {

    private static final int FIRST_BATCH_INDEX = 1;

    private static final Map<EventKind, NonceList> LISTS = new EnumMap<>(Map.of(
            EventKind.LOOKS_RARE_V2_SUBSET_NONCES_CANCELLED, new NonceList("subsetNonces", true),
            EventKind.LOOKS_RARE_V2_ORDER_NONCES_CANCELLED, new NonceList("orderNonces", false)
    ));

    @Override
    public Set<EventKind> kinds() {
        return LISTS.keySet();
    }

    @Override
    public HandlerOutcome handle(RawEvent event, DecodedEvent decoded, TransactionLogCache txLogs, OnChainData out) {
        NonceList list = LISTS.get(decoded.getKind());
        OrderKind orderKind = decoded.getKind().getOrderKind();
        String maker = decoded.address("user");
        List<BigInteger> nonces = decoded.uintList(list.field());
        if (nonces.isEmpty()) {
            log.warn("Empty {} list in tx {} log {}, nothing to cancel",
                    list.field(), event.txHash(), event.originParams().logIndex());
            return HandlerOutcome.SKIPPED_INVALID;
        }

        List<NonceCancelEvent> cancels = new ArrayList<>(nonces.size());
        int batchIndex = FIRST_BATCH_INDEX;
        for (BigInteger nonce : nonces) {
            cancels.add(NonceCancelEvent.of(orderKind, maker, nonce, list.subset(),
                    event.originParams().withBatchIndex(batchIndex++)));
        }
        cancels.forEach(out::addNonceCancelEvent);
        return HandlerOutcome.APPLIED;
    }

    private record NonceList(String field, boolean subset) {
    }
}
