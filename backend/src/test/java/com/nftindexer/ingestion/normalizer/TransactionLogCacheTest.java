package com.nftindexer.ingestion.normalizer;

import org.junit.jupiter.api.Test;

import static com.nftindexer.ingestion.LooksRareV2Logs.WETH;
import static com.nftindexer.ingestion.LooksRareV2Logs.erc20Transfer;
import static com.nftindexer.ingestion.LooksRareV2Logs.origin;
import static org.assertj.core.api.Assertions.assertThat;

class TransactionLogCacheTest {

    @Test
    void observe_sameTx_accumulates() {
        TransactionLogCache cache = new TransactionLogCache();
        cache.observe(erc20Transfer(origin("0xtx1", 1, 0), WETH));
        cache.observe(erc20Transfer(origin("0xtx1", 2, 0), WETH));

        assertThat(cache.getCurrentTxHash()).isEqualTo("0xtx1");
        assertThat(cache.logs()).hasSize(2);
    }

    @Test
    void observe_newTx_resets() {
        TransactionLogCache cache = new TransactionLogCache();
        cache.observe(erc20Transfer(origin("0xtx1", 1, 0), WETH));
        cache.observe(erc20Transfer(origin("0xtx2", 7, 0), WETH));

        assertThat(cache.getCurrentTxHash()).isEqualTo("0xtx2");
        assertThat(cache.logs()).singleElement().satisfies(l -> assertThat(l.logIndex()).isEqualTo(7));
    }
}
