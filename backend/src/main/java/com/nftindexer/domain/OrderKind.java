package com.nftindexer.domain;

/**
 * Marketplace protocol an order belongs to. The value is the tag persisted downstream.
 */
public enum OrderKind {
    LOOKS_RARE_V2("looks-rare-v2");

    private final String value;

    OrderKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
