package com.nftindexer.ingestion.normalizer.handler;

import com.nftindexer.domain.BulkCancelEvent;
import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.OrderKind;
import com.nftindexer.domain.OrderSide;
import com.nftindexer.domain.OriginParams;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.decoder.DecodedEvent;
import com.nftindexer.ingestion.normalizer.EventHandler;
import com.nftindexer.ingestion.normalizer.HandlerOutcome;
import com.nftindexer.ingestion.normalizer.TransactionLogCache;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Set;

/**
 * New bid/ask nonces: every order of the maker below the new nonce is void. Emits the ask side then the bid
 * side, with batch indexes continuing from the raw event's own.
 */
@Component
public class BulkNonceInvalidationHandler implements EventHandler {

    @Override
    public Set<EventKind> kinds() {
        return Set.of(EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES);
    }

    @Override
    public HandlerOutcome handle(RawEvent event, DecodedEvent decoded, TransactionLogCache txLogs, OnChainData out) {
        OrderKind orderKind = decoded.getKind().getOrderKind();
        String maker = decoded.address("user");
        BigInteger askNonce = decoded.uint("askNonce");
        BigInteger bidNonce = decoded.uint("bidNonce");

        OriginParams origin = event.originParams();
        int batchIndex = origin.batchIndex();
        BulkCancelEvent asks = BulkCancelEvent.of(orderKind, maker, askNonce, OrderSide.SELL, true,
                origin.withBatchIndex(batchIndex++));
        BulkCancelEvent bids = BulkCancelEvent.of(orderKind, maker, bidNonce, OrderSide.BUY, true,
                origin.withBatchIndex(batchIndex));

        out.addBulkCancelEvent(asks);
        out.addBulkCancelEvent(bids);
        return HandlerOutcome.APPLIED;
    }
}
