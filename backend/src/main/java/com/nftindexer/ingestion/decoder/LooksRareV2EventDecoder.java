package com.nftindexer.ingestion.decoder;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.EventLog;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decodes LooksRare V2 exchange events. None of their arguments are indexed, so everything is read
 * from the data words.
 */
@Component
public class LooksRareV2EventDecoder implements EventDecoder {

    /** NonceInvalidationParameters(3) + 2 users + strategyId + currency + collection + 2 offsets + address[2] + uint256[3]. */
    private static final int TAKER_HEAD_WORDS = 15;

    private static final Set<EventKind> KINDS = EnumSet.of(
            EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES,
            EventKind.LOOKS_RARE_V2_SUBSET_NONCES_CANCELLED,
            EventKind.LOOKS_RARE_V2_ORDER_NONCES_CANCELLED,
            EventKind.LOOKS_RARE_V2_TAKER_ASK,
            EventKind.LOOKS_RARE_V2_TAKER_BID
    );

    @Override
    public Set<EventKind> supportedKinds() {
        return KINDS;
    }

    @Override
    public DecodedEvent decode(EventKind kind, EventLog log) {
        if (!kind.getTopic().equalsIgnoreCase(log.topic0())) {
            throw new DecodeException("Log topic " + log.topic0() + " does not match " + kind.getTag());
        }
        AbiDataReader data = AbiDataReader.of(log.data());
        return switch (kind) {
            case LOOKS_RARE_V2_NEW_BID_ASK_NONCES -> {
                data.requireWords(3);
                yield DecodedEvent.builder(kind)
                        .field("user", data.address(0))
                        .field("bidNonce", data.uint(1))
                        .field("askNonce", data.uint(2))
                        .build();
            }
            case LOOKS_RARE_V2_SUBSET_NONCES_CANCELLED -> decodeNonceList(kind, data, "subsetNonces");
            case LOOKS_RARE_V2_ORDER_NONCES_CANCELLED -> decodeNonceList(kind, data, "orderNonces");
            case LOOKS_RARE_V2_TAKER_ASK -> decodeTaker(kind, data, "askUser", "bidUser");
            case LOOKS_RARE_V2_TAKER_BID -> decodeTaker(kind, data, "bidUser", "bidRecipient");
        };
    }

    private static DecodedEvent decodeNonceList(EventKind kind, AbiDataReader data, String listName) {
        data.requireWords(3);
        return DecodedEvent.builder(kind)
                .field("user", data.address(0))
                .field(listName, data.uintArray(1))
                .build();
    }

    private static DecodedEvent decodeTaker(EventKind kind, AbiDataReader data, String firstUser, String secondUser) {
        data.requireWords(TAKER_HEAD_WORDS);
        return DecodedEvent.builder(kind)
                .field("orderHash", data.bytes32(0))
                .field("orderNonce", data.uint(1))
                .field("isNonceInvalidated", data.bool(2))
                .field(firstUser, data.address(3))
                .field(secondUser, data.address(4))
                .field("strategyId", data.uint(5))
                .field("currency", data.address(6))
                .field("collection", data.address(7))
                .field("itemIds", data.uintArray(8))
                .field("amounts", data.uintArray(9))
                .field("feeRecipients", data.fixedAddressArray(10, 2))
                .field("feeAmounts", data.fixedUintArray(12, 3))
                .build();
    }
}
