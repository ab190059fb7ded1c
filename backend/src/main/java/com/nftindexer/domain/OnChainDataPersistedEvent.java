package com.nftindexer.domain;

import java.util.List;

/**
 * Published after the canonical events of a batch are stored; carries the triggers for the job dispatcher.
 */
public record OnChainDataPersistedEvent(List<OrderInfo> orderInfos, List<FillInfo> fillInfos,
                                        List<MakerInfo> makerInfos) {

    public OnChainDataPersistedEvent {
        orderInfos = List.copyOf(orderInfos);
        fillInfos = List.copyOf(fillInfos);
        makerInfos = List.copyOf(makerInfos);
    }
}
