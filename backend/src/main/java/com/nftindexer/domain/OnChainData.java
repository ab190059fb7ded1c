package com.nftindexer.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulator filled by one normalization pass. Append-only: records keep the order of the raw events that
 * produced them and are never removed. Owned by a single pass; not thread-safe.
 */
public class OnChainData {

    private final List<FillEvent> fillEvents = new ArrayList<>();
    private final List<NonceCancelEvent> nonceCancelEvents = new ArrayList<>();
    private final List<BulkCancelEvent> bulkCancelEvents = new ArrayList<>();
    private final List<OrderInfo> orderInfos = new ArrayList<>();
    private final List<FillInfo> fillInfos = new ArrayList<>();
    private final List<MakerInfo> makerInfos = new ArrayList<>();

    public void addFillEvent(FillEvent event) {
        fillEvents.add(event);
    }

    public void addNonceCancelEvent(NonceCancelEvent event) {
        nonceCancelEvents.add(event);
    }

    public void addBulkCancelEvent(BulkCancelEvent event) {
        bulkCancelEvents.add(event);
    }

    public void addOrderInfo(OrderInfo info) {
        orderInfos.add(info);
    }

    public void addFillInfo(FillInfo info) {
        fillInfos.add(info);
    }

    public void addMakerInfo(MakerInfo info) {
        makerInfos.add(info);
    }

    /**
     * Appends every record of {@code other} after the records already held, list by list.
     * Used to merge per-transaction accumulators back in chronological order.
     */
    public void appendAll(OnChainData other) {
        fillEvents.addAll(other.fillEvents);
        nonceCancelEvents.addAll(other.nonceCancelEvents);
        bulkCancelEvents.addAll(other.bulkCancelEvents);
        orderInfos.addAll(other.orderInfos);
        fillInfos.addAll(other.fillInfos);
        makerInfos.addAll(other.makerInfos);
    }

    public List<FillEvent> getFillEvents() {
        return Collections.unmodifiableList(fillEvents);
    }

    public List<NonceCancelEvent> getNonceCancelEvents() {
        return Collections.unmodifiableList(nonceCancelEvents);
    }

    public List<BulkCancelEvent> getBulkCancelEvents() {
        return Collections.unmodifiableList(bulkCancelEvents);
    }

    public List<OrderInfo> getOrderInfos() {
        return Collections.unmodifiableList(orderInfos);
    }

    public List<FillInfo> getFillInfos() {
        return Collections.unmodifiableList(fillInfos);
    }

    public List<MakerInfo> getMakerInfos() {
        return Collections.unmodifiableList(makerInfos);
    }

    public int size() {
        return fillEvents.size() + nonceCancelEvents.size() + bulkCancelEvents.size()
                + orderInfos.size() + fillInfos.size() + makerInfos.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
