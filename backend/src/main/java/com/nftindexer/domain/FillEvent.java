package com.nftindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;

/**
 * Completed trade. {@code price} is the native-asset price and is always present: a fill whose native price
 * cannot be resolved is never produced. {@code currencyPrice} is per single unit of the asset.
 * Id is {@code txHash-logIndex-batchIndex} so replays upsert in place.
 */
@Document(collection = "fill_events")
@CompoundIndexes({
    @CompoundIndex(name = "contract_tokenId", def = "{'contract': 1, 'tokenId': 1}"),
    @CompoundIndex(name = "orderId", def = "{'orderId': 1}"),
    @CompoundIndex(name = "maker_orderKind", def = "{'maker': 1, 'orderKind': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FillEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private OrderKind orderKind;
    private String orderId;
    private OrderSide orderSide;
    private String maker;
    private String taker;
    /** Native units (wei). */
    private BigInteger price;
    private String currency;
    /** Currency smallest units, per single unit of the asset. */
    private BigInteger currencyPrice;
    /** Micro-dollars (USD x 10^6); null when no USD rate was available. */
    private BigInteger usdPrice;
    private String contract;
    private String tokenId;
    private String amount;
    private String orderSourceId;
    private String aggregatorSourceId;
    private String fillSourceId;
    private OriginParams originParams;

    public void setOriginParams(OriginParams originParams) {
        this.originParams = originParams;
        this.id = originParams == null ? null : originParams.eventId();
    }
}
