package com.nftindexer.domain;

/**
 * Request to re-synchronize a maker's approval state for {@code data.contract}.
 */
public record MakerInfo(String context, String maker, Trigger trigger, Data data) {

    public record Data(ApprovalKind kind, String contract, OrderKind orderKind) {
    }
}
