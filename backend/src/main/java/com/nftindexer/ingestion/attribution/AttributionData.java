package com.nftindexer.ingestion.attribution;

/**
 * Every component is optional (null when unknown).
 *
 * @param taker override for the decoded taker, e.g. the wallet behind an aggregator contract
 */
public record AttributionData(String taker, Source orderSource, Source aggregatorSource, Source fillSource) {

    private static final AttributionData NONE = new AttributionData(null, null, null, null);

    public static AttributionData none() {
        return NONE;
    }

    public String orderSourceId() {
        return orderSource == null ? null : orderSource.id();
    }

    public String aggregatorSourceId() {
        return aggregatorSource == null ? null : aggregatorSource.id();
    }

    public String fillSourceId() {
        return fillSource == null ? null : fillSource.id();
    }

    /**
     * A marketplace, aggregator or referrer credited for a trade.
     */
    public record Source(String id, String domain) {
    }
}
