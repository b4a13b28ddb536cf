package com.myorg.choirsplit.service.processing;

import com.myorg.choirsplit.model.LyricOccurrence;
import com.myorg.choirsplit.model.MeasurePosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeMap;

/**
 * Lyrics collected before splitting, indexed by (measure, time position).
 * Entries at one position keep their collection order; exact duplicates are dropped.
 */
public class LyricTable {

    private final TreeMap<MeasurePosition, List<LyricOccurrence>> byPosition = new TreeMap<>();

    public void add(LyricOccurrence occurrence) {
        List<LyricOccurrence> slot = byPosition.computeIfAbsent(occurrence.position(), k -> new ArrayList<>());
        if (!slot.contains(occurrence)) slot.add(occurrence);
    }

    public List<LyricOccurrence> at(MeasurePosition position) {
        List<LyricOccurrence> slot = byPosition.get(position);
        return slot == null ? List.of() : List.copyOf(slot);
    }

    /** Nearest populated position strictly before {@code position}, or null. */
    public MeasurePosition before(MeasurePosition position) {
        return byPosition.lowerKey(position);
    }

    /** Nearest populated position strictly after {@code position}, or null. */
    public MeasurePosition after(MeasurePosition position) {
        return byPosition.higherKey(position);
    }

    public List<LyricOccurrence> all() {
        List<LyricOccurrence> out = new ArrayList<>();
        byPosition.values().forEach(out::addAll);
        return out;
    }

    public void replaceWith(Collection<LyricOccurrence> occurrences) {
        byPosition.clear();
        occurrences.forEach(this::add);
    }

    public int size() {
        return byPosition.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return byPosition.isEmpty();
    }
}
