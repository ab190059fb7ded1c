package com.nftindexer.ingestion.classifier;

import com.nftindexer.domain.EventLog;

import java.util.List;
import java.util.Optional;

/**
 * Finds the ERC-20 contract paid with in a transaction, from the logs seen for it.
 */
public interface Erc20TransferDetector {

    /**
     * @param transactionLogs logs of one transaction, in log order
     * @return lowercase contract of the first ERC-20 transfer, if any
     */
    Optional<String> detect(List<EventLog> transactionLogs);
}
