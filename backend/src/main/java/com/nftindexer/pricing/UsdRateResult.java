package com.nftindexer.pricing;

import com.nftindexer.domain.PriceSource;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * USD rate of a whole currency unit with its source, or UNKNOWN.
 */
@Getter
public class UsdRateResult {

    private static final UsdRateResult UNKNOWN = new UsdRateResult(null, PriceSource.UNKNOWN);

    private final BigDecimal rateUsd;
    private final PriceSource priceSource;

    private UsdRateResult(BigDecimal rateUsd, PriceSource priceSource) {
        this.rateUsd = rateUsd;
        this.priceSource = priceSource;
    }

    public static UsdRateResult known(BigDecimal rateUsd, PriceSource source) {
        if (rateUsd == null || rateUsd.signum() <= 0 || source == null || source == PriceSource.UNKNOWN) {
            return UNKNOWN;
        }
        return new UsdRateResult(rateUsd, source);
    }

    public static UsdRateResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return priceSource == PriceSource.UNKNOWN || rateUsd == null;
    }

    public Optional<BigDecimal> getRateUsd() {
        return Optional.ofNullable(rateUsd);
    }
}
