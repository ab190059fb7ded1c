package com.nftindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.math.BigInteger;
import java.util.List;

public interface NonceCancelEventRepository extends MongoRepository<NonceCancelEvent, String> {

    List<NonceCancelEvent> findByOrderKindAndMakerAndNonce(OrderKind orderKind, String maker, BigInteger nonce);
}
