package com.tenderwatch.monitor.store;

import com.tenderwatch.monitor.model.DiffResult;
import com.tenderwatch.monitor.model.Tender;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class TenderDiff {
    private TenderDiff() {}

    public static DiffResult diff(List<Tender> snapshot, Set<String> known) {
        if (snapshot == null || snapshot.isEmpty()) {
            return new DiffResult(List.of(), 0);
        }
        Set<String> seen = new HashSet<>(known == null ? Set.of() : known);
        List<Tender> fresh = new ArrayList<>();
        int duplicates = 0;
        for (Tender tender : snapshot) {
            if (seen.add(tender.identityKey())) {
                fresh.add(tender);
            } else {
                duplicates++;
            }
        }
        return new DiffResult(fresh, duplicates);
    }
}
