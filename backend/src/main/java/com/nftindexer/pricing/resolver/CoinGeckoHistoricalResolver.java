package com.nftindexer.pricing.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nftindexer.common.CurrencyRegistry;
import com.nftindexer.common.RateLimiter;
import com.nftindexer.domain.PriceSource;
import com.nftindexer.pricing.UsdRateRequest;
import com.nftindexer.pricing.UsdRateResult;
import com.nftindexer.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Daily USD rate via CoinGecko /coins/{id}/history (the API wants dd-MM-yyyy). Throttled by a shared
 * {@link RateLimiter}; known rates are cached per (currency, day), misses are retried on the next call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoHistoricalResolver {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;
    private final CurrencyRegistry currencyRegistry;

    @Cacheable(cacheNames = "historicalPriceCache", key = "#request.currency + '-' + #request.date",
            unless = "#result.unknown")
    public UsdRateResult resolve(UsdRateRequest request) {
        if (request == null || request.getCurrency() == null || request.getDate() == null) {
            return UsdRateResult.unknown();
        }
        String coinId = coinIdFor(request.getCurrency());
        if (coinId == null || coinId.isBlank()) {
            log.debug("No CoinGecko id for currency {}", request.getCurrency());
            return UsdRateResult.unknown();
        }
        rateLimiter.acquire();
        String dateStr = request.getDate().format(DATE_FORMAT);
        String url = pricingProperties.getCoingeckoBaseUrl() + "/coins/" + coinId
                + "/history?date=" + dateStr + "&localization=false";
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()));
            return parseUsdPrice(response)
                    .map(p -> UsdRateResult.known(p, PriceSource.COINGECKO))
                    .orElse(UsdRateResult.unknown());
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko history failed for {} date {}: {}", coinId, dateStr, e.getMessage());
            return UsdRateResult.unknown();
        } catch (RuntimeException e) {
            log.warn("CoinGecko history error for {} date {}", coinId, dateStr, e);
            return UsdRateResult.unknown();
        }
    }

    private String coinIdFor(String currency) {
        if (currencyRegistry.isNativeEquivalent(currency)) {
            return pricingProperties.getNativeCoinGeckoId();
        }
        return pricingProperties.getContractToCoinGeckoId().get(currency.toLowerCase().strip());
    }

    static Optional<BigDecimal> parseUsdPrice(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode usd = MAPPER.readTree(json).path("market_data").path("current_price").path("usd");
            if (usd.isMissingNode() || !usd.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(usd.decimalValue());
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
