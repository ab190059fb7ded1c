package com.nftindexer.ingestion.classifier;

import com.nftindexer.domain.EventLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nftindexer.ingestion.LooksRareV2Logs.COLLECTION;
import static com.nftindexer.ingestion.LooksRareV2Logs.WETH;
import static com.nftindexer.ingestion.LooksRareV2Logs.erc20Transfer;
import static com.nftindexer.ingestion.LooksRareV2Logs.erc721Transfer;
import static com.nftindexer.ingestion.LooksRareV2Logs.origin;
import static org.assertj.core.api.Assertions.assertThat;

class TopicErc20TransferDetectorTest {

    private final TopicErc20TransferDetector detector = new TopicErc20TransferDetector();

    @Test
    void detect_erc20Transfer_returnsLowerCasedToken() {
        EventLog log = erc20Transfer(origin("0xtx", 1, 0), WETH.toUpperCase().replace("0X", "0x")).log();

        assertThat(detector.detect(List.of(log))).contains(WETH);
    }

    @Test
    void detect_erc721TransferOnly_returnsEmpty() {
        EventLog log = erc721Transfer(origin("0xtx", 1, 0), COLLECTION).log();

        assertThat(detector.detect(List.of(log))).isEmpty();
    }

    @Test
    void detect_firstErc20Wins() {
        String other = "0x" + "9".repeat(40);
        List<EventLog> logs = List.of(
                erc721Transfer(origin("0xtx", 1, 0), COLLECTION).log(),
                erc20Transfer(origin("0xtx", 2, 0), other).log(),
                erc20Transfer(origin("0xtx", 3, 0), WETH).log());

        assertThat(detector.detect(logs)).contains(other);
    }

    @Test
    void detect_otherTopicOrNoLogs_returnsEmpty() {
        EventLog approval = new EventLog(WETH,
                List.of("0x8c5be1e5ebec7d5bd14f71427d1e84f3dd0314c0f7b2291e5b200ac8c7c3b925", "0x01", "0x02"), "0x", 1);

        assertThat(detector.detect(List.of(approval))).isEmpty();
        assertThat(detector.detect(List.of())).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }
}
