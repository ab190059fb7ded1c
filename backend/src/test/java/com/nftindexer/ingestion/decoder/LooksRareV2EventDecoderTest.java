package com.nftindexer.ingestion.decoder;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.EventLog;
import com.nftindexer.domain.RawEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.nftindexer.ingestion.LooksRareV2Logs.COLLECTION;
import static com.nftindexer.ingestion.LooksRareV2Logs.ORDER_HASH;
import static com.nftindexer.ingestion.LooksRareV2Logs.WETH;
import static com.nftindexer.ingestion.LooksRareV2Logs.address;
import static com.nftindexer.ingestion.LooksRareV2Logs.newBidAskNonces;
import static com.nftindexer.ingestion.LooksRareV2Logs.origin;
import static com.nftindexer.ingestion.LooksRareV2Logs.subsetNoncesCancelled;
import static com.nftindexer.ingestion.LooksRareV2Logs.takerAsk;
import static com.nftindexer.ingestion.LooksRareV2Logs.takerBid;
import static com.nftindexer.ingestion.LooksRareV2Logs.uint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LooksRareV2EventDecoderTest {

    private static final String USER = "0x" + "d".repeat(40);
    private static final String A = "0x" + "a".repeat(40);
    private static final String B = "0x" + "b".repeat(40);

    private final LooksRareV2EventDecoder decoder = new LooksRareV2EventDecoder();

    @Test
    @DisplayName("supports all five LooksRare V2 kinds")
    void supportsAllKinds() {
        assertThat(decoder.supportedKinds()).containsExactlyInAnyOrder(EventKind.values());
    }

    @Test
    @DisplayName("decodes NewBidAskNonces")
    void decodeNewBidAskNonces() {
        RawEvent raw = newBidAskNonces(origin("0xtx", 1, 0), USER, 10, 20);

        DecodedEvent decoded = decoder.decode(EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES, raw.log());

        assertThat(decoded.address("user")).isEqualTo(USER);
        assertThat(decoded.uint("bidNonce")).isEqualTo(BigInteger.TEN);
        assertThat(decoded.uint("askNonce")).isEqualTo(BigInteger.valueOf(20));
    }

    @Test
    @DisplayName("decodes a dynamic nonce list")
    void decodeSubsetNonces() {
        RawEvent raw = subsetNoncesCancelled(origin("0xtx", 1, 0), USER, 1, 2, 3);

        DecodedEvent decoded = decoder.decode(EventKind.LOOKS_RARE_V2_SUBSET_NONCES_CANCELLED, raw.log());

        assertThat(decoded.uintList("subsetNonces"))
                .containsExactly(BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3));
    }

    @Test
    @DisplayName("decodes TakerBid with its user roles and arrays")
    void decodeTakerBid() {
        RawEvent raw = takerBid(origin("0xtx", 1, 0)).users(A, B).currency(WETH)
                .itemIds(42).amounts(2).feeAmounts(900, 50, 50).build();

        DecodedEvent decoded = decoder.decode(EventKind.LOOKS_RARE_V2_TAKER_BID, raw.log());

        assertThat(decoded.bytes32("orderHash")).isEqualTo(ORDER_HASH);
        assertThat(decoded.uint("orderNonce")).isEqualTo(BigInteger.valueOf(5));
        assertThat(decoded.bool("isNonceInvalidated")).isTrue();
        assertThat(decoded.address("bidUser")).isEqualTo(A);
        assertThat(decoded.address("bidRecipient")).isEqualTo(B);
        assertThat(decoded.address("currency")).isEqualTo(WETH);
        assertThat(decoded.address("collection")).isEqualTo(COLLECTION);
        assertThat(decoded.uintList("itemIds")).containsExactly(BigInteger.valueOf(42));
        assertThat(decoded.uintList("amounts")).containsExactly(BigInteger.TWO);
        assertThat(decoded.uintList("feeAmounts"))
                .containsExactly(BigInteger.valueOf(900), BigInteger.valueOf(50), BigInteger.valueOf(50));
        assertThat(decoded.addressList("feeRecipients")).hasSize(2);
    }

    @Test
    @DisplayName("TakerAsk names its users askUser and bidUser")
    void decodeTakerAsk() {
        RawEvent raw = takerAsk(origin("0xtx", 1, 0)).users(A, B).build();

        DecodedEvent decoded = decoder.decode(EventKind.LOOKS_RARE_V2_TAKER_ASK, raw.log());

        assertThat(decoded.address("askUser")).isEqualTo(A);
        assertThat(decoded.address("bidUser")).isEqualTo(B);
        assertThatThrownBy(() -> decoded.address("bidRecipient")).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("upper-case hex is accepted and addresses come out lower-case")
    void upperCaseHex_lowerCasedAddresses() {
        RawEvent raw = newBidAskNonces(origin("0xtx", 1, 0), USER, 1, 2);
        EventLog upper = new EventLog(raw.log().address(), raw.log().topics(),
                "0x" + raw.log().data().substring(2).toUpperCase(), 1);

        DecodedEvent decoded = decoder.decode(EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES, upper);

        assertThat(decoded.address("user")).isEqualTo(USER);
    }

    @Test
    @DisplayName("topic0 of another event is rejected")
    void topicMismatch_rejected() {
        RawEvent raw = newBidAskNonces(origin("0xtx", 1, 0), USER, 1, 2);

        assertThatThrownBy(() -> decoder.decode(EventKind.LOOKS_RARE_V2_TAKER_BID, raw.log()))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    @DisplayName("short or non-hex data is rejected")
    void malformedData_rejected() {
        String topic = EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES.getTopic();

        assertThatThrownBy(() -> decoder.decode(EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES,
                new EventLog("0x1", List.of(topic), "0x" + address(USER) + uint(1), 0)))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> decoder.decode(EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES,
                new EventLog("0x1", List.of(topic), "0x" + "zz".repeat(96), 0)))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> decoder.decode(EventKind.LOOKS_RARE_V2_NEW_BID_ASK_NONCES,
                new EventLog("0x1", List.of(topic), null, 0)))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("array offset pointing past the data is rejected")
    void outOfRangeOffset_rejected() {
        String topic = EventKind.LOOKS_RARE_V2_ORDER_NONCES_CANCELLED.getTopic();
        String data = "0x" + address(USER) + uint(32 * 50) + uint(0);

        assertThatThrownBy(() -> decoder.decode(EventKind.LOOKS_RARE_V2_ORDER_NONCES_CANCELLED,
                new EventLog("0x1", List.of(topic), data, 0)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("offset");
    }

    @Test
    @DisplayName("array length running past the data is rejected")
    void overlongArray_rejected() {
        String topic = EventKind.LOOKS_RARE_V2_ORDER_NONCES_CANCELLED.getTopic();
        String data = "0x" + address(USER) + uint(64) + uint(5) + uint(1);

        assertThatThrownBy(() -> decoder.decode(EventKind.LOOKS_RARE_V2_ORDER_NONCES_CANCELLED,
                new EventLog("0x1", List.of(topic), data, 0)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("overruns");
    }
}
