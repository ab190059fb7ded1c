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
 * Invalidation of every order of {@code maker} on {@code orderSide} whose nonce is &lt;= {@code minNonce}.
 */
@Document(collection = "bulk_cancel_events")
@CompoundIndex(name = "orderKind_maker_side", def = "{'orderKind': 1, 'maker': 1, 'orderSide': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BulkCancelEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private OrderKind orderKind;
    private String maker;
    private BigInteger minNonce;
    private OrderSide orderSide;
    /** Scheme-wide invalidation rather than one limited to a nonce subset. */
    private boolean acrossAll;
    private OriginParams originParams;

    public static BulkCancelEvent of(OrderKind orderKind, String maker, BigInteger minNonce, OrderSide orderSide,
                                     boolean acrossAll, OriginParams originParams) {
        BulkCancelEvent e = new BulkCancelEvent();
        e.setOrderKind(orderKind);
        e.setMaker(maker);
        e.setMinNonce(minNonce);
        e.setOrderSide(orderSide);
        e.setAcrossAll(acrossAll);
        e.setOriginParams(originParams);
        return e;
    }

    public void setOriginParams(OriginParams originParams) {
        this.originParams = originParams;
        this.id = originParams == null ? null : originParams.eventId();
    }
}
