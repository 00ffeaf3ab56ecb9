package com.lbg.markets.turbosort.trigger;

import com.lbg.markets.turbosort.source.ObjectSummary;
import com.lbg.markets.turbosort.source.S3Source;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Difference between two full listings of a remote source.
 */
public record ListingDiff(Set<String> added, Set<String> modified, Set<String> deleted) {

    public static ListingDiff between(Map<String, ObjectSummary> previous, Map<String, ObjectSummary> current) {
        Set<String> added = new TreeSet<>();
        Set<String> modified = new TreeSet<>();
        Set<String> deleted = new TreeSet<>();

        current.forEach((key, now) -> {
            ObjectSummary before = previous.get(key);
            if (before == null) {
                added.add(key);
            } else if (changed(before, now)) {
                modified.add(key);
            }
        });
        for (String key : previous.keySet()) {
            if (!current.containsKey(key)) {
                deleted.add(key);
            }
        }
        return new ListingDiff(Set.copyOf(added), Set.copyOf(modified), Set.copyOf(deleted));
    }

    /**
     * Content tags decide; without tags on both sides, size and modification time do.
     */
    private static boolean changed(ObjectSummary before, ObjectSummary now) {
        if (before.eTag() != null && now.eTag() != null) {
            return !before.eTag().equals(now.eTag());
        }
        return before.sizeBytes() != now.sizeBytes()
                || before.lastModifiedEpochMs() != now.lastModifiedEpochMs()
                || !Objects.equals(before.eTag(), now.eTag());
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && deleted.isEmpty();
    }

    /**
     * Distinct parent prefixes of every added or modified key, in order.
     */
    public Set<String> locationsToProcess() {
        return Stream.concat(added.stream(), modified.stream())
                .map(S3Source::parentOf)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
