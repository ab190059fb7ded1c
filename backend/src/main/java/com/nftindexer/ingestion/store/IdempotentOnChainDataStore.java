package com.nftindexer.ingestion.store;

import com.nftindexer.domain.BulkCancelEventRepository;
import com.nftindexer.domain.FillEventRepository;
import com.nftindexer.domain.NonceCancelEventRepository;
import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.OnChainDataPersistedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Upserts canonical events keyed by (txHash, logIndex, batchIndex), so replaying a batch after a restart or
 * reorg leaves one document per key. Triggers are then published for the job dispatcher.
 */
@Service
@RequiredArgsConstructor
public class IdempotentOnChainDataStore {

    private final FillEventRepository fillEventRepository;
    private final NonceCancelEventRepository nonceCancelEventRepository;
    private final BulkCancelEventRepository bulkCancelEventRepository;
    private final ApplicationEventPublisher eventPublisher;

    public void persist(OnChainData data) {
        if (data.isEmpty()) {
            return;
        }
        if (!data.getFillEvents().isEmpty()) {
            fillEventRepository.saveAll(data.getFillEvents());
        }
        if (!data.getNonceCancelEvents().isEmpty()) {
            nonceCancelEventRepository.saveAll(data.getNonceCancelEvents());
        }
        if (!data.getBulkCancelEvents().isEmpty()) {
            bulkCancelEventRepository.saveAll(data.getBulkCancelEvents());
        }
        if (!data.getOrderInfos().isEmpty() || !data.getFillInfos().isEmpty() || !data.getMakerInfos().isEmpty()) {
            eventPublisher.publishEvent(new OnChainDataPersistedEvent(
                    data.getOrderInfos(), data.getFillInfos(), data.getMakerInfos()));
        }
    }
}
