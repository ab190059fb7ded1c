package com.nftindexer.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Pricing module configuration. Documented in application.yml under nftindexer.pricing.
 */
@ConfigurationProperties(prefix = "nftindexer.pricing")
@Getter
@Setter
public class PricingProperties {

    /** CoinGecko API base URL (free: https://api.coingecko.com/api/v3). */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /** Requests per minute allowed against /coins/{id}/history. */
    private int coingeckoHistoricalRequestsPerMinute = 30;

    /** Read timeout in seconds for a single CoinGecko call. Keep below nftindexer.ingestion.normalization.price-timeout-ms. */
    private int readTimeoutSeconds = 4;

    /** CoinGecko id of the chain's native asset; also used for WETH. */
    private String nativeCoinGeckoId = "ethereum";

    /** Currency contract (lowercase) → CoinGecko coin id, for non-stable ERC-20 payment currencies. */
    private Map<String, String> contractToCoinGeckoId = new HashMap<>();
}
