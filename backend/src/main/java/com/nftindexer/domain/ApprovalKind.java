package com.nftindexer.domain;

public enum ApprovalKind {
    BUY_APPROVAL("buy-approval"),
    SELL_APPROVAL("sell-approval");

    private final String value;

    ApprovalKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
