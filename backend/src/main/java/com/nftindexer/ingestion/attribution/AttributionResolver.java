package com.nftindexer.ingestion.attribution;

import com.nftindexer.domain.OrderKind;

/**
 * Credits the economic actors of a fill: the real taker behind a router and the order, aggregator and fill
 * sources. Implementations may fail; callers treat failure as "no attribution".
 */
public interface AttributionResolver {

    AttributionData resolve(String txHash, OrderKind orderKind, String orderId);
}
