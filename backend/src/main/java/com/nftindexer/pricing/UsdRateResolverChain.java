package com.nftindexer.pricing;

import com.nftindexer.pricing.resolver.CoinGeckoHistoricalResolver;
import com.nftindexer.pricing.resolver.StablecoinResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Stablecoins short-circuit to $1; everything else goes to CoinGecko daily history.
 */
@Component
@RequiredArgsConstructor
public class UsdRateResolverChain implements UsdRateResolver {

    private final StablecoinResolver stablecoinResolver;
    private final CoinGeckoHistoricalResolver coinGeckoHistoricalResolver;

    @Override
    public UsdRateResult resolve(UsdRateRequest request) {
        UsdRateResult r = stablecoinResolver.resolve(request);
        if (!r.isUnknown()) {
            return r;
        }
        return coinGeckoHistoricalResolver.resolve(request);
    }
}
