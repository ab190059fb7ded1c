package com.nftindexer.pricing;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Result of price resolution. Native price in wei, USD price in micro-dollars (USD x 10^6).
 * A missing native price means the price is unknown, whatever the USD side says.
 */
public final class PriceData {

    private static final PriceData UNAVAILABLE = new PriceData(null, null);

    private final BigInteger nativePrice;
    private final BigInteger usdPrice;

    private PriceData(BigInteger nativePrice, BigInteger usdPrice) {
        this.nativePrice = nativePrice;
        this.usdPrice = usdPrice;
    }

    public static PriceData of(BigInteger nativePrice, BigInteger usdPrice) {
        if (nativePrice == null) {
            return UNAVAILABLE;
        }
        return new PriceData(nativePrice, usdPrice);
    }

    public static PriceData unavailable() {
        return UNAVAILABLE;
    }

    public Optional<BigInteger> getNativePrice() {
        return Optional.ofNullable(nativePrice);
    }

    public Optional<BigInteger> getUsdPrice() {
        return Optional.ofNullable(usdPrice);
    }

    public boolean isAvailable() {
        return nativePrice != null;
    }

    @Override
    public String toString() {
        return "PriceData{nativePrice=" + nativePrice + ", usdPrice=" + usdPrice + '}';
    }
}
