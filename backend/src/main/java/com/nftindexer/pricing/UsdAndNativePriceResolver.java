package com.nftindexer.pricing;

import com.nftindexer.common.CurrencyRegistry;
import com.nftindexer.common.CurrencyRegistry.CurrencyInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Prices a currency amount in wei and micro-dollars from daily USD rates.
 * <ul>
 *   <li>ETH / WETH: the amount already is the native price; USD only if the ETH rate is known.</li>
 *   <li>Other currencies: native = amount x currencyRate / ethRate, rescaled from the currency's decimals to 18.
 *       Unknown decimals or either rate unknown means no native price.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsdAndNativePriceResolver implements PriceResolver {

    private static final int NATIVE_DECIMALS = 18;
    private static final int USD_DECIMALS = 6;

    private final UsdRateResolver usdRateResolver;
    private final CurrencyRegistry currencyRegistry;

    @Override
    public PriceData resolve(String currency, BigInteger unitPrice, long timestamp) {
        if (currency == null || unitPrice == null || unitPrice.signum() < 0) {
            return PriceData.unavailable();
        }
        Instant at = Instant.ofEpochSecond(timestamp);
        Optional<BigDecimal> nativeRate = usdRateResolver
                .resolve(new UsdRateRequest(CurrencyRegistry.NATIVE_CURRENCY, at))
                .getRateUsd();

        if (currencyRegistry.isNativeEquivalent(currency)) {
            BigInteger usd = nativeRate.map(rate -> toMicroUsd(unitPrice, NATIVE_DECIMALS, rate)).orElse(null);
            return PriceData.of(unitPrice, usd);
        }

        Optional<CurrencyInfo> info = currencyRegistry.find(currency);
        if (info.isEmpty()) {
            log.debug("Unknown currency {}, no decimals to price with", currency);
            return PriceData.unavailable();
        }
        Optional<BigDecimal> currencyRate = usdRateResolver.resolve(new UsdRateRequest(currency, at)).getRateUsd();
        if (currencyRate.isEmpty() || nativeRate.isEmpty()) {
            log.debug("Missing USD rate for {} or native asset at {}", currency, at);
            return PriceData.unavailable();
        }
        int decimals = info.get().decimals();
        BigInteger usd = toMicroUsd(unitPrice, decimals, currencyRate.get());
        BigInteger nativePrice = new BigDecimal(unitPrice)
                .multiply(currencyRate.get())
                .movePointRight(NATIVE_DECIMALS - decimals)
                .divide(nativeRate.get(), 0, RoundingMode.DOWN)
                .toBigInteger();
        return PriceData.of(nativePrice, usd);
    }

    private static BigInteger toMicroUsd(BigInteger amount, int decimals, BigDecimal rateUsd) {
        return new BigDecimal(amount)
                .multiply(rateUsd)
                .movePointRight(USD_DECIMALS - decimals)
                .setScale(0, RoundingMode.DOWN)
                .toBigInteger();
    }
}
