package com.lbg.markets.turbosort.ledger;

import com.lbg.markets.turbosort.domain.DeliveryRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Simple in-memory ledger.
 * Not persistent - state is lost on restart. Subclasses add storage by overriding
 * {@link #load()} and {@link #persist()}.
 */
public class InMemoryLedger implements Ledger {

    protected final Map<String, DeliveryRecord> recordsByKey = new ConcurrentHashMap<>();

    @Override
    public void load() {
        // Nothing persisted
    }

    @Override
    public Optional<DeliveryRecord> get(String sourceKey) {
        return Optional.ofNullable(recordsByKey.get(sourceKey));
    }

    @Override
    public void put(DeliveryRecord record) {
        recordsByKey.put(record.sourceKey(), record);
        persist();
    }

    @Override
    public boolean remove(String sourceKey) {
        return recordsByKey.remove(sourceKey) != null;
    }

    @Override
    public int prune(Predicate<String> stillExists) {
        List<String> stale = new ArrayList<>();
        for (String sourceKey : recordsByKey.keySet()) {
            if (!stillExists.test(sourceKey)) {
                stale.add(sourceKey);
            }
        }
        stale.forEach(recordsByKey::remove);
        if (!stale.isEmpty()) {
            persist();
        }
        return stale.size();
    }

    @Override
    public void clear() {
        recordsByKey.clear();
        persist();
    }

    @Override
    public void persist() {
        // Nothing to write
    }

    @Override
    public Collection<DeliveryRecord> records() {
        return List.copyOf(recordsByKey.values());
    }
}
