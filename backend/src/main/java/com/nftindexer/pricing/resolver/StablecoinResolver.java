package com.nftindexer.pricing.resolver;

import com.nftindexer.common.CurrencyRegistry;
import com.nftindexer.domain.PriceSource;
import com.nftindexer.pricing.UsdRateRequest;
import com.nftindexer.pricing.UsdRateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Resolves USD stablecoins (USDC, USDT, DAI, FRAX) to $1.00.
 */
@Component
@RequiredArgsConstructor
public class StablecoinResolver {

    private final CurrencyRegistry currencyRegistry;

    public UsdRateResult resolve(UsdRateRequest request) {
        if (request == null || request.getCurrency() == null) {
            return UsdRateResult.unknown();
        }
        if (currencyRegistry.isStablecoin(request.getCurrency())) {
            return UsdRateResult.known(BigDecimal.ONE, PriceSource.STABLECOIN);
        }
        return UsdRateResult.unknown();
    }
}
