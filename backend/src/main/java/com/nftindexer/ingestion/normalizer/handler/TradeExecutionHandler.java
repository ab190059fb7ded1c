package com.nftindexer.ingestion.normalizer.handler;

import com.nftindexer.domain.ApprovalKind;
import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.FillEvent;
import com.nftindexer.domain.FillInfo;
import com.nftindexer.domain.MakerInfo;
import com.nftindexer.domain.NonceCancelEvent;
import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.OrderInfo;
import com.nftindexer.domain.OrderKind;
import com.nftindexer.domain.OrderSide;
import com.nftindexer.domain.OriginParams;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.domain.Trigger;
import com.nftindexer.domain.TriggerKind;
import com.nftindexer.ingestion.attribution.AttributionData;
import com.nftindexer.ingestion.classifier.Erc20TransferDetector;
import com.nftindexer.ingestion.decoder.DecodedEvent;
import com.nftindexer.ingestion.normalizer.EventHandler;
import com.nftindexer.ingestion.normalizer.HandlerOutcome;
import com.nftindexer.ingestion.normalizer.ResolverGuard;
import com.nftindexer.ingestion.normalizer.TransactionLogCache;
import com.nftindexer.pricing.PriceData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Taker-ask and taker-bid executions. For a single-item trade with a resolvable native price appends, in order:
 * the fill, the maker's same-nonce cancellation, the "sale" order trigger and the fill projection; then an
 * approval resync for the maker when the transaction moved an ERC-20.
 * Bundles are skipped silently; a trade without native price leaves no record at all.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TradeExecutionHandler implements EventHandler {

    private static final Map<EventKind, Variant> VARIANTS = new EnumMap<>(Map.of(
            // maker's bid was taken: buy side from the maker's perspective
            EventKind.LOOKS_RARE_V2_TAKER_ASK, new Variant(OrderSide.BUY, "bidUser", "askUser"),
            // maker's ask was taken
            EventKind.LOOKS_RARE_V2_TAKER_BID, new Variant(OrderSide.SELL, "bidUser", "bidRecipient")
    ));

    private final ResolverGuard resolverGuard;
    private final Erc20TransferDetector erc20TransferDetector;

    @Override
    public Set<EventKind> kinds() {
        return VARIANTS.keySet();
    }

    @Override
    public HandlerOutcome handle(RawEvent event, DecodedEvent decoded, TransactionLogCache txLogs, OnChainData out) {
        Variant variant = VARIANTS.get(decoded.getKind());
        OrderKind orderKind = decoded.getKind().getOrderKind();
        OriginParams origin = event.originParams();

        String orderId = decoded.bytes32("orderHash").toLowerCase();
        BigInteger orderNonce = decoded.uint("orderNonce");
        String maker = decoded.address(variant.makerField());
        String taker = decoded.address(variant.takerField());
        String currency = decoded.address("currency");
        String contract = decoded.address("collection");
        List<BigInteger> itemIds = decoded.uintList("itemIds");
        List<BigInteger> amounts = decoded.uintList("amounts");
        List<BigInteger> feeAmounts = decoded.uintList("feeAmounts");

        if (itemIds.size() > 1) {
            log.debug("Skipping bundle of {} items in tx {} log {}", itemIds.size(), origin.txHash(), origin.logIndex());
            return HandlerOutcome.SKIPPED_UNSUPPORTED;
        }
        if (itemIds.isEmpty() || amounts.isEmpty() || feeAmounts.isEmpty()) {
            log.warn("Data quality: {} in tx {} log {} has no item, amount or fee amount",
                    decoded.getKind().getTag(), origin.txHash(), origin.logIndex());
            return HandlerOutcome.SKIPPED_INVALID;
        }
        BigInteger amount = amounts.get(0);
        if (amount.signum() <= 0) {
            log.warn("Data quality: zero amount for order {} in tx {} log {}", orderId, origin.txHash(), origin.logIndex());
            return HandlerOutcome.SKIPPED_INVALID;
        }
        String tokenId = itemIds.get(0).toString();

        AttributionData attribution = resolverGuard.attribution(origin.txHash(), orderKind, orderId);
        if (attribution.taker() != null && !attribution.taker().isBlank()) {
            taker = attribution.taker().toLowerCase();
        }

        BigInteger currencyPrice = feeAmounts.get(0).divide(amount);
        PriceData priceData = resolverGuard.price(currency, currencyPrice, origin.timestamp());
        Optional<BigInteger> nativePrice = priceData.getNativePrice();
        if (nativePrice.isEmpty()) {
            log.warn("No native price for {} {} at {}, dropping fill of order {} (tx {})",
                    currencyPrice, currency, origin.timestamp(), orderId, origin.txHash());
            return HandlerOutcome.SKIPPED_PRICE_UNAVAILABLE;
        }

        FillEvent fill = new FillEvent();
        fill.setOrderKind(orderKind);
        fill.setOrderId(orderId);
        fill.setOrderSide(variant.orderSide());
        fill.setMaker(maker);
        fill.setTaker(taker);
        fill.setPrice(nativePrice.get());
        fill.setCurrency(currency);
        fill.setCurrencyPrice(currencyPrice);
        fill.setUsdPrice(priceData.getUsdPrice().orElse(null));
        fill.setContract(contract);
        fill.setTokenId(tokenId);
        fill.setAmount(amount.toString());
        fill.setOrderSourceId(attribution.orderSourceId());
        fill.setAggregatorSourceId(attribution.aggregatorSourceId());
        fill.setFillSourceId(attribution.fillSourceId());
        fill.setOriginParams(origin);

        Trigger sale = new Trigger(TriggerKind.SALE, origin.txHash(), origin.timestamp());
        out.addFillEvent(fill);
        // An executed order cannot be filled or cancelled again under the same nonce
        out.addNonceCancelEvent(NonceCancelEvent.of(orderKind, maker, orderNonce, false, origin));
        out.addOrderInfo(new OrderInfo("filled-" + orderId, orderId, sale));
        out.addFillInfo(new FillInfo(orderId, orderId, variant.orderSide(), contract, tokenId, amount.toString(),
                nativePrice.get(), origin.timestamp(), maker, taker));

        erc20TransferDetector.detect(txLogs.logs()).ifPresent(erc20 -> out.addMakerInfo(new MakerInfo(
                origin.txHash() + "-buy-approval",
                maker,
                new Trigger(TriggerKind.APPROVAL_CHANGE, origin.txHash(), origin.timestamp()),
                new MakerInfo.Data(ApprovalKind.BUY_APPROVAL, erc20, orderKind))));
        return HandlerOutcome.APPLIED;
    }

    private record Variant(OrderSide orderSide, String makerField, String takerField) {
    }
}
