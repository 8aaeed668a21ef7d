package com.tenderwatch.monitor.store;

import com.tenderwatch.monitor.model.DiffResult;
import com.tenderwatch.monitor.model.Tender;

import java.util.List;
import java.util.Set;

/**
 * Durable, append-only set of tender identities that have already been processed.
 *
 * <p>{@link #load()} and {@link #diff(List, Set)} never mutate anything. {@link #commit(List)} is
 * the only write; it is all-or-nothing, so a reader observes either the state before the commit or
 * the state after it.
 */
public interface SeenTenderStore {

    /**
     * Returns the identity keys (see {@link Tender#identityKey()}) of every committed tender. A
     * backing medium that does not exist yet is an empty store.
     *
     * @throws StoreUnavailableException if the medium exists but cannot be read
     */
    Set<String> load();

    default DiffResult diff(List<Tender> snapshot, Set<String> known) {
        return TenderDiff.diff(snapshot, known);
    }

    /**
     * Appends tenders whose identity is not yet stored. Tenders already present are left
     * untouched.
     *
     * @throws CommitFailedException if the write could not be made durable; nothing from this
     *     call is then visible
     */
    void commit(List<Tender> newTenders);

    String describe();
}
