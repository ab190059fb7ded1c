package com.nftindexer.ingestion.pipeline;

import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.store.IdempotentOnChainDataStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.nftindexer.ingestion.LooksRareV2Logs.newBidAskNonces;
import static com.nftindexer.ingestion.LooksRareV2Logs.origin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventsSyncProcessorTest {

    @Mock
    private BatchNormalizationRunner runner;
    @Mock
    private IdempotentOnChainDataStore store;
    @InjectMocks
    private EventsSyncProcessor processor;

    @Test
    void process_normalizesThenPersists() {
        List<RawEvent> events = List.of(newBidAskNonces(origin("0xtx", 1, 0), "0x" + "d".repeat(40), 1, 2));
        OnChainData data = new OnChainData();
        when(runner.normalize(events)).thenReturn(data);

        assertThat(processor.process(events)).isSameAs(data);

        InOrder order = inOrder(runner, store);
        order.verify(runner).normalize(events);
        order.verify(store).persist(data);
    }

    @Test
    void process_emptyBatch_doesNothing() {
        assertThat(processor.process(List.of()).isEmpty()).isTrue();
        verifyNoInteractions(runner, store);
    }
}
