package com.nftindexer.ingestion.pipeline;

import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.config.IngestionConfig;
import com.nftindexer.ingestion.config.NormalizationProperties;
import com.nftindexer.ingestion.normalizer.EventNormalizationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Normalizes a batch with resolver I/O overlapped across transactions. The batch is cut into contiguous
 * per-transaction groups, each normalized into its own accumulator, and the accumulators are merged back
 * in input order, so the output equals a sequential pass.
 */
@Component
@Slf4j
public class BatchNormalizationRunner {

    private final EventNormalizationEngine engine;
    private final Executor executor;
    private final NormalizationProperties properties;

    public BatchNormalizationRunner(EventNormalizationEngine engine,
                                    @Qualifier(IngestionConfig.NORMALIZATION_EXECUTOR) Executor executor,
                                    NormalizationProperties properties) {
        this.engine = engine;
        this.executor = executor;
        this.properties = properties;
    }

    public OnChainData normalize(List<RawEvent> events) {
        if (!properties.isParallelBatches()) {
            return engine.normalize(events);
        }
        List<List<RawEvent>> groups = groupByTransaction(events);
        if (groups.size() <= 1) {
            return engine.normalize(events);
        }

        List<CompletableFuture<OnChainData>> parts = new ArrayList<>(groups.size());
        for (List<RawEvent> group : groups) {
            parts.add(CompletableFuture.supplyAsync(() -> engine.normalize(group), executor));
        }
        OnChainData merged = new OnChainData();
        try {
            for (CompletableFuture<OnChainData> part : parts) {
                merged.appendAll(part.join());
            }
        } catch (CompletionException e) {
            parts.forEach(p -> p.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        log.debug("Normalized {} raw event(s) in {} transaction group(s) into {} record(s)",
                events.size(), groups.size(), merged.size());
        return merged;
    }

    /**
     * Splits on every change of tx hash, the same boundary at which the engine resets its log cache.
     */
    static List<List<RawEvent>> groupByTransaction(List<RawEvent> events) {
        List<List<RawEvent>> groups = new ArrayList<>();
        List<RawEvent> current = null;
        String currentTx = null;
        for (RawEvent event : events) {
            String txHash = event == null ? null : event.txHash();
            if (current == null || !Objects.equals(currentTx, txHash)) {
                current = new ArrayList<>();
                groups.add(current);
                currentTx = txHash;
            }
            current.add(event);
        }
        return groups;
    }
}
