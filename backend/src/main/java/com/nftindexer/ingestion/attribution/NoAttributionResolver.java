package com.nftindexer.ingestion.attribution;

import com.nftindexer.domain.OrderKind;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback used when the deployment provides no attribution service: decoded takers are kept as-is.
 */
@Slf4j
public class NoAttributionResolver implements AttributionResolver {

    @Override
    public AttributionData resolve(String txHash, OrderKind orderKind, String orderId) {
        log.trace("No attribution service configured, tx {} order {}", txHash, orderId);
        return AttributionData.none();
    }
}
