package com.nftindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for fill_events. Keyed by {@code txHash-logIndex-batchIndex}; save() is an upsert.
 */
public interface FillEventRepository extends MongoRepository<FillEvent, String> {

    List<FillEvent> findByOrderId(String orderId);
}
