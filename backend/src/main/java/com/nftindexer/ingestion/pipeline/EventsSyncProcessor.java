package com.nftindexer.ingestion.pipeline;

import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.store.IdempotentOnChainDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for a fetched batch of marketplace logs: normalize, then hand the records to the store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventsSyncProcessor {

    private final BatchNormalizationRunner batchNormalizationRunner;
    private final IdempotentOnChainDataStore onChainDataStore;

    public OnChainData process(List<RawEvent> events) {
        if (events == null || events.isEmpty()) {
            return new OnChainData();
        }
        OnChainData data = batchNormalizationRunner.normalize(events);
        onChainDataStore.persist(data);
        log.info("Synced {} raw event(s): {} fill(s), {} nonce cancel(s), {} bulk cancel(s)",
                events.size(), data.getFillEvents().size(), data.getNonceCancelEvents().size(),
                data.getBulkCancelEvents().size());
        return data;
    }
}
