package com.nftindexer.domain;

/**
 * Order status-machine trigger. {@code context} deduplicates repeated triggers for the same cause.
 */
public record OrderInfo(String context, String orderId, Trigger trigger) {
}
