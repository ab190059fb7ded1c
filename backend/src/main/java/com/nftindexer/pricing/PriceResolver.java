package com.nftindexer.pricing;

import java.math.BigInteger;

/**
 * Converts a currency amount at a point in time into native-asset and USD prices.
 */
public interface PriceResolver {

    /**
     * @param currency  payment currency contract (lowercase)
     * @param unitPrice amount in the currency's smallest unit
     * @param timestamp epoch seconds of the block
     * @return prices; {@link PriceData#unavailable()} when no native price can be produced
     */
    PriceData resolve(String currency, BigInteger unitPrice, long timestamp);
}
