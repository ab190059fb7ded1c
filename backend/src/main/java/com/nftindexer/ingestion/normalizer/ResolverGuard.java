package com.nftindexer.ingestion.normalizer;

import com.nftindexer.domain.OrderKind;
import com.nftindexer.ingestion.attribution.AttributionData;
import com.nftindexer.ingestion.attribution.AttributionResolver;
import com.nftindexer.ingestion.config.IngestionConfig;
import com.nftindexer.ingestion.config.NormalizationProperties;
import com.nftindexer.pricing.PriceData;
import com.nftindexer.pricing.PriceResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external resolver calls with a per-call timeout and maps every failure to the resolver's fallback:
 * no attribution for the attribution resolver, unavailable price for the price resolver.
 * The calling thread waits for the result, so records still land in input order.
 */
@Component
@Slf4j
public class ResolverGuard {

    private final AttributionResolver attributionResolver;
    private final PriceResolver priceResolver;
    private final Executor executor;
    private final NormalizationProperties properties;

    public ResolverGuard(AttributionResolver attributionResolver,
                         PriceResolver priceResolver,
                         @Qualifier(IngestionConfig.RESOLVER_EXECUTOR) Executor executor,
                         NormalizationProperties properties) {
        this.attributionResolver = attributionResolver;
        this.priceResolver = priceResolver;
        this.executor = executor;
        this.properties = properties;
    }

    public AttributionData attribution(String txHash, OrderKind orderKind, String orderId) {
        return call(() -> attributionResolver.resolve(txHash, orderKind, orderId),
                properties.getAttributionTimeoutMs(), AttributionData.none(),
                "attribution for order " + orderId + " in tx " + txHash);
    }

    public PriceData price(String currency, BigInteger unitPrice, long timestamp) {
        return call(() -> priceResolver.resolve(currency, unitPrice, timestamp),
                properties.getPriceTimeoutMs(), PriceData.unavailable(),
                "price of " + unitPrice + " " + currency + " at " + timestamp);
    }

    private <T> T call(Callable<T> callable, long timeoutMs, T fallback, String description) {
        // cancel(true) must interrupt the worker so calls queued behind a timed-out one get the thread
        FutureTask<T> task = new FutureTask<>(callable);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Resolver pool rejected {}: {}", description, e.getMessage());
            return fallback;
        }
        try {
            T result = task.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : fallback;
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Timed out after {}ms resolving {}", timeoutMs, description);
            return fallback;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Failed resolving {}: {}", description, cause.getMessage(), cause);
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            log.warn("Interrupted while resolving {}", description);
            return fallback;
        }
    }
}
