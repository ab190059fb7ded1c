package com.nftindexer.domain;

/**
 * How a USD rate was determined. Priority: STABLECOIN &gt; COINGECKO &gt; UNKNOWN.
 */
public enum PriceSource {
    STABLECOIN,
    COINGECKO,
    UNKNOWN
}
