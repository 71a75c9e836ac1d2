package com.roundpilot.core.events;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Selects which round events a feed subscriber receives.
 *
 * @param sourceIds     sources to include; empty means every source
 * @param excludedTypes event types never delivered
 */
public record FeedFilter(Set<String> sourceIds, Set<String> excludedTypes) {

    public FeedFilter {
        sourceIds = Set.copyOf(sourceIds);
        excludedTypes = Set.copyOf(excludedTypes);
    }

    public static FeedFilter everything() {
        return new FeedFilter(Set.of(), Set.of());
    }

    public static FeedFilter forSources(Collection<String> sourceIds) {
        return new FeedFilter(Set.copyOf(sourceIds), Set.of());
    }

    /** Phase changes fire on every transition of every source; round-level feeds usually drop them. */
    public FeedFilter withoutPhaseChanges() {
        return new FeedFilter(sourceIds, union(excludedTypes, RoundEvent.PHASE_CHANGED));
    }

    public boolean accepts(RoundEvent event) {
        return (sourceIds.isEmpty() || sourceIds.contains(event.sourceId()))
                && !excludedTypes.contains(event.eventType());
    }

    private static Set<String> union(Set<String> types, String extra) {
        var copy = new HashSet<>(types);
        copy.add(extra);
        return copy;
    }
}
