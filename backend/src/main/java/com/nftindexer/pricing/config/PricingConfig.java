package com.nftindexer.pricing.config;

import com.nftindexer.common.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pricing module configuration: properties and the CoinGecko rate limiter.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public RateLimiter coingeckoHistoricalRateLimiter(PricingProperties pricingProperties) {
        return new RateLimiter(pricingProperties.getCoingeckoHistoricalRequestsPerMinute());
    }
}
