package com.nftindexer.pricing;

/**
 * Resolves the historical USD rate of a currency. Chain: Stablecoin → CoinGecko → UNKNOWN.
 */
public interface UsdRateResolver {

    UsdRateResult resolve(UsdRateRequest request);
}
