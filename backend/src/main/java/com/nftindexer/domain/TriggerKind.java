package com.nftindexer.domain;

/**
 * Cause of an order or maker status re-evaluation.
 */
public enum TriggerKind {
    SALE("sale"),
    CANCEL("cancel"),
    APPROVAL_CHANGE("approval-change");

    private final String value;

    TriggerKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
