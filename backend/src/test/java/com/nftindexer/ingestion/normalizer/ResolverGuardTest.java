package com.nftindexer.ingestion.normalizer;

import com.nftindexer.domain.OrderKind;
import com.nftindexer.ingestion.attribution.AttributionData;
import com.nftindexer.ingestion.attribution.AttributionResolver;
import com.nftindexer.ingestion.config.NormalizationProperties;
import com.nftindexer.pricing.PriceData;
import com.nftindexer.pricing.PriceResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResolverGuardTest {

    @Mock
    private AttributionResolver attributionResolver;
    @Mock
    private PriceResolver priceResolver;

    private ExecutorService executor;
    private ResolverGuard guard;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        NormalizationProperties props = new NormalizationProperties();
        props.setAttributionTimeoutMs(100);
        props.setPriceTimeoutMs(100);
        guard = new ResolverGuard(attributionResolver, priceResolver, executor, props);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("returns the resolver result when it answers in time")
    void passesThroughResults() {
        PriceData price = PriceData.of(BigInteger.TEN, BigInteger.ONE);
        when(priceResolver.resolve("0xc", BigInteger.TWO, 5L)).thenReturn(price);

        assertThat(guard.price("0xc", BigInteger.TWO, 5L)).isSameAs(price);
    }

    @Test
    @DisplayName("slow attribution falls back to no attribution")
    void attributionTimeout() {
        when(attributionResolver.resolve(any(), any(), any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return new AttributionData("0xlate", null, null, null);
        });

        long start = System.nanoTime();
        AttributionData result = guard.attribution("0xtx", OrderKind.LOOKS_RARE_V2, "0xorder");
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(result).isEqualTo(AttributionData.none());
        assertThat(elapsedMs).isLessThan(1_500);
    }

    @Test
    @DisplayName("slow price falls back to unavailable")
    void priceTimeout() {
        when(priceResolver.resolve(any(), any(), anyLong())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return PriceData.of(BigInteger.ONE, null);
        });

        assertThat(guard.price("0xc", BigInteger.ONE, 1L).isAvailable()).isFalse();
    }

    @Test
    @DisplayName("failing resolvers fall back")
    void failures() {
        when(attributionResolver.resolve(any(), any(), any())).thenThrow(new IllegalStateException("down"));
        when(priceResolver.resolve(any(), any(), anyLong())).thenThrow(new IllegalStateException("down"));

        assertThat(guard.attribution("0xtx", OrderKind.LOOKS_RARE_V2, "0xorder")).isEqualTo(AttributionData.none());
        assertThat(guard.price("0xc", BigInteger.ONE, 1L)).isEqualTo(PriceData.unavailable());
    }

    @Test
    @DisplayName("null resolver answers fall back")
    void nullResults() {
        assertThat(guard.attribution("0xtx", OrderKind.LOOKS_RARE_V2, "0xorder")).isEqualTo(AttributionData.none());
        assertThat(guard.price("0xc", BigInteger.ONE, 1L)).isEqualTo(PriceData.unavailable());
    }

    @Test
    @DisplayName("rejected submission falls back")
    void rejectedSubmission() {
        executor.shutdownNow();

        assertThat(guard.price("0xc", BigInteger.ONE, 1L)).isEqualTo(PriceData.unavailable());
    }

    @Test
    @DisplayName("timed-out call is interrupted and does not starve the next call")
    void slowCallDoesNotStarveNextCall() throws InterruptedException {
        executor.shutdownNow();
        executor = Executors.newSingleThreadExecutor();
        NormalizationProperties props = new NormalizationProperties();
        props.setPriceTimeoutMs(200);
        guard = new ResolverGuard(attributionResolver, priceResolver, executor, props);

        PriceData fast = PriceData.of(BigInteger.TEN, null);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch slowInterrupted = new CountDownLatch(1);
        when(priceResolver.resolve(any(), any(), anyLong())).thenAnswer(inv -> {
            if (calls.getAndIncrement() == 0) {
                try {
                    Thread.sleep(1_500);
                } catch (InterruptedException e) {
                    slowInterrupted.countDown();
                    throw e;
                }
            }
            return fast;
        });

        PriceData first = guard.price("0xc", BigInteger.ONE, 1L);
        PriceData second = guard.price("0xc", BigInteger.ONE, 2L);

        assertThat(first.isAvailable()).isFalse();
        assertThat(slowInterrupted.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(second).isSameAs(fast);
        assertThat(calls.get()).isEqualTo(2);
    }
}
