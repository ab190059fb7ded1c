package com.nftindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;

/**
 * Invalidation of one exact nonce of one maker. {@code subset} marks the separate subset-nonce space.
 */
@Document(collection = "nonce_cancel_events")
@CompoundIndex(name = "orderKind_maker_nonce", def = "{'orderKind': 1, 'maker': 1, 'nonce': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NonceCancelEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private OrderKind orderKind;
    private String maker;
    private BigInteger nonce;
    private boolean subset;
    private OriginParams originParams;

    public static NonceCancelEvent of(OrderKind orderKind, String maker, BigInteger nonce, boolean subset,
                                      OriginParams originParams) {
        NonceCancelEvent e = new NonceCancelEvent();
        e.setOrderKind(orderKind);
        e.setMaker(maker);
        e.setNonce(nonce);
        e.setSubset(subset);
        e.setOriginParams(originParams);
        return e;
    }

    public void setOriginParams(OriginParams originParams) {
        this.originParams = originParams;
        this.id = originParams == null ? null : originParams.eventId();
    }
}
