package com.nftindexer.ingestion.classifier;

import com.nftindexer.domain.EventLog;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * ERC-20 and ERC-721 share the Transfer(address,address,uint256) signature; ERC-20 leaves the amount
 * un-indexed (3 topics) while ERC-721 indexes the token id (4 topics).
 */
@Component
public class TopicErc20TransferDetector implements Erc20TransferDetector {

    /** Transfer(address,address,uint256) topic. */
    public static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    @Override
    public Optional<String> detect(List<EventLog> transactionLogs) {
        if (transactionLogs == null) {
            return Optional.empty();
        }
        for (EventLog log : transactionLogs) {
            if (log == null || log.address() == null) continue;
            List<String> topics = log.topics();
            if (topics.size() == 3 && TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
                return Optional.of(log.address().toLowerCase().strip());
            }
        }
        return Optional.empty();
    }
}
