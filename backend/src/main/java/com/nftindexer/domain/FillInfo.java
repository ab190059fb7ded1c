package com.nftindexer.domain;

import java.math.BigInteger;

/**
 * Query-friendly projection of a fill for statistics and activity feeds.
 */
public record FillInfo(
        String context,
        String orderId,
        OrderSide orderSide,
        String contract,
        String tokenId,
        String amount,
        BigInteger price,
        long timestamp,
        String maker,
        String taker
) {
}
