package com.nftindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BulkCancelEventRepository extends MongoRepository<BulkCancelEvent, String> {

    List<BulkCancelEvent> findByOrderKindAndMakerAndOrderSide(OrderKind orderKind, String maker, OrderSide orderSide);
}
