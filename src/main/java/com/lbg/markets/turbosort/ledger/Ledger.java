package com.lbg.markets.turbosort.ledger;

import com.lbg.markets.turbosort.domain.DeliveryRecord;
import com.lbg.markets.turbosort.domain.LedgerStats;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Record of what has already been delivered, keyed by source item.
 * Used from a single thread; every mutation except {@link #remove(String)} is written through.
 */
public interface Ledger {

    /**
     * Replace the in-memory state with the persisted one. Missing or unreadable
     * storage yields an empty ledger rather than an error.
     */
    void load();

    Optional<DeliveryRecord> get(String sourceKey);

    /**
     * Insert or replace the record for its source key, then persist.
     */
    void put(DeliveryRecord record);

    /**
     * Delete the entry without persisting; call {@link #persist()} afterwards.
     */
    boolean remove(String sourceKey);

    /**
     * Remove every entry whose source no longer exists, persisting once if anything changed.
     *
     * @return number of entries removed
     */
    int prune(Predicate<String> stillExists);

    /**
     * Drop all entries and persist the empty ledger.
     */
    void clear();

    void persist();

    Collection<DeliveryRecord> records();

    default boolean shouldSkip(String sourceKey, String identity) {
        return get(sourceKey)
                .map(rec -> rec.matches(identity))
                .orElse(false);
    }

    default LedgerStats stats() {
        return LedgerStats.of(records());
    }
}
