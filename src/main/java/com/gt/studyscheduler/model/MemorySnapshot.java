package com.gt.studyscheduler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of every {@link CardMemoryState} known for a learner. All scheduling functions take and return
 * snapshots by value; a changed card produces a new snapshot and leaves the old one untouched.
 */
public record MemorySnapshot(List<CardMemoryState> states) {

    public static final MemorySnapshot EMPTY = new MemorySnapshot(List.of());

    public MemorySnapshot {
        states = states == null ? List.of() : List.copyOf(states);
    }

    public Optional<CardMemoryState> find(String itemId) {
        return states.stream().filter(state -> itemId.equals(state.itemId())).findFirst();
    }

    /**
     * Returns a snapshot where the entry for {@code state.itemId()} is replaced, or appended when absent. Order of
     * the other entries is preserved.
     */
    public MemorySnapshot withState(CardMemoryState state) {
        List<CardMemoryState> newStates = new ArrayList<>(states.size() + 1);
        boolean replaced = false;

        for (CardMemoryState existing : states) {
            if (state.itemId().equals(existing.itemId())) {
                newStates.add(state);
                replaced = true;
            } else {
                newStates.add(existing);
            }
        }

        if (!replaced) {
            newStates.add(state);
        }

        return new MemorySnapshot(newStates);
    }

    public Set<String> itemIds() {
        return states.stream().map(CardMemoryState::itemId).filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    public int size() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }
}
