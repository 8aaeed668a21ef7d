package com.tenderwatch.monitor.collect;

import com.tenderwatch.monitor.model.Tender;

import java.util.List;
import java.util.Optional;

/**
 * Produces the full snapshot of currently active tenders. An empty list is a valid snapshot;
 * failing to produce any snapshot at all is signalled with {@link CollectionFailedException}.
 */
public interface TenderCollector {
    List<Tender> collect(Optional<String> scopeFilter);
}
