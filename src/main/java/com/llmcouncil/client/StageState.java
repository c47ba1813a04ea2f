package com.llmcouncil.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Consumer view of one fan-out stage, keyed by model so duplicated or reordered arrivals
 * cannot produce duplicate entries.
 *
 * @param loading true between the stage's start and completion events
 * @param pending models dispatched but not yet reported, in dispatch order
 * @param entries successful results by model, in arrival order until the completion event
 *                replaces them with its own order
 */
public record StageState<T>(
        boolean loading,
        Set<String> pending,
        Map<String, T> entries
) {

    public StageState {
        pending = Collections.unmodifiableSet(new LinkedHashSet<>(pending));
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static <T> StageState<T> notStarted() {
        return new StageState<>(false, Set.of(), Map.of());
    }

    public StageState<T> started(List<String> models) {
        return new StageState<>(true, new LinkedHashSet<>(models), Map.of());
    }

    /**
     * Records that {@code model} reported. A {@code null} result marks a failed model, which
     * only leaves the pending set. A model already present keeps its first entry.
     */
    public StageState<T> arrived(String model, T result) {
        Set<String> nextPending = new LinkedHashSet<>(pending);
        nextPending.remove(model);
        if (result == null || entries.containsKey(model)) {
            return new StageState<>(loading, nextPending, entries);
        }
        Map<String, T> nextEntries = new LinkedHashMap<>(entries);
        nextEntries.put(model, result);
        return new StageState<>(loading, nextPending, nextEntries);
    }

    /**
     * Replaces whatever arrivals accumulated with the authoritative list.
     */
    public StageState<T> completed(List<T> authoritative, Function<T, String> modelOf) {
        Map<String, T> replaced = new LinkedHashMap<>();
        for (T result : authoritative) {
            replaced.put(modelOf.apply(result), result);
        }
        return new StageState<>(false, Set.of(), replaced);
    }

    public StageState<T> stopped() {
        return new StageState<>(false, pending, entries);
    }

    public List<T> values() {
        return new ArrayList<>(entries.values());
    }
}
