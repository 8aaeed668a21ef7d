package com.tenderwatch.monitor.model;

import java.util.List;

/**
 * Partition of a snapshot into tenders never seen before (in snapshot order) and the number of
 * entries dropped as duplicates, either already known or repeated within the snapshot.
 */
public record DiffResult(List<Tender> newTenders, int duplicateCount) {
    public DiffResult {
        newTenders = List.copyOf(newTenders);
    }

    public boolean hasNewTenders() {
        return !newTenders.isEmpty();
    }
}
