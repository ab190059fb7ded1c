package com.nftindexer.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Protocol-specific log kinds the normalization engine understands.
 * Each kind carries its wire tag (as assigned by the upstream log filter), its order kind
 * and topic0 of the emitting event.
 */
public enum EventKind {

    /** NewBidAskNonces(address user, uint256 bidNonce, uint256 askNonce) */
    LOOKS_RARE_V2_NEW_BID_ASK_NONCES("looks-rare-v2-new-bid-ask-nonces", OrderKind.LOOKS_RARE_V2,
            "0xb738dd6073fae1a7128e3fcc6b4ca6e1356b7232f87cc98f8a2857bcd83dfc44"),
    /** SubsetNoncesCancelled(address user, uint256[] subsetNonces) */
    LOOKS_RARE_V2_SUBSET_NONCES_CANCELLED("looks-rare-v2-subset-nonces-cancelled", OrderKind.LOOKS_RARE_V2,
            "0xe8036d6fb143373f3ff63e551373f5fffe4267f6809bf6d3934014a18a9b38f6"),
    /** OrderNoncesCancelled(address user, uint256[] orderNonces) */
    LOOKS_RARE_V2_ORDER_NONCES_CANCELLED("looks-rare-v2-order-nonces-cancelled", OrderKind.LOOKS_RARE_V2,
            "0x0560c6093fba8a508d0e6ea3b4d7260d7afa9b152731f03a2d05dfe39b0ec425"),
    /** TakerAsk((bytes32,uint256,bool),address,address,uint256,address,address,uint256[],uint256[],address[2],uint256[3]) */
    LOOKS_RARE_V2_TAKER_ASK("looks-rare-v2-taker-ask", OrderKind.LOOKS_RARE_V2,
            "0x9aaa45d6db2ef74ead0751ea9113263d1dec1b50cea05f0ca2002cb8063564a4"),
    /** TakerBid((bytes32,uint256,bool),address,address,uint256,address,address,uint256[],uint256[],address[2],uint256[3]) */
    LOOKS_RARE_V2_TAKER_BID("looks-rare-v2-taker-bid", OrderKind.LOOKS_RARE_V2,
            "0x3ee3de4684413690dee6fff1a0a4f92916a1b97d1c5a83cdf24671844306b2e3");

    private static final Map<String, EventKind> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventKind::getTag, Function.identity()));

    private final String tag;
    private final OrderKind orderKind;
    private final String topic;

    EventKind(String tag, OrderKind orderKind, String topic) {
        this.tag = tag;
        this.orderKind = orderKind;
        this.topic = topic;
    }

    public String getTag() {
        return tag;
    }

    public OrderKind getOrderKind() {
        return orderKind;
    }

    public String getTopic() {
        return topic;
    }

    /**
     * Looks up a kind by its wire tag. Unknown tags yield empty so newer upstream kinds pass through untouched.
     */
    public static Optional<EventKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag.strip()));
    }
}
