package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.LyricOccurrence;

import java.util.List;
import java.util.Optional;

/**
 * One way of picking, among the lyrics recorded at a position, the one that belongs to a
 * chord of staff {@code originalStaffId} on {@code line}. Strategies are tried in order.
 */
@FunctionalInterface
public interface LyricMatchStrategy {

    Optional<Lyric> match(List<LyricOccurrence> candidates, int originalStaffId, int line);

    /**
     * A second verse printed under the staff above belongs to this staff's upper line.
     * Split staff ids advance by two, hence {@code originalStaffId - 2}.
     */
    LyricMatchStrategy UPPER_STAFF_SECOND_VERSE = (candidates, staffId, line) -> {
        if (line != 0) return Optional.empty();
        return candidates.stream()
                .filter(o -> o.getStaffId() == staffId - 2 && "1".equals(o.getLyric().getVerse()))
                .findFirst()
                .map(o -> o.getLyric().toBuilder().verse("").build());
    };

    LyricMatchStrategy SAME_STAFF_SAME_LINE = (candidates, staffId, line) -> candidates.stream()
            .filter(o -> o.getStaffId() == staffId && o.getLine() == line)
            .findFirst()
            .map(LyricOccurrence::getLyric);

    LyricMatchStrategy SAME_STAFF = (candidates, staffId, line) -> candidates.stream()
            .filter(o -> o.getStaffId() == staffId)
            .findFirst()
            .map(LyricOccurrence::getLyric);

    LyricMatchStrategy SAME_LINE = (candidates, staffId, line) -> candidates.stream()
            .filter(o -> o.getLine() == line)
            .findFirst()
            .map(LyricOccurrence::getLyric);

    LyricMatchStrategy FIRST = (candidates, staffId, line) -> candidates.stream()
            .findFirst()
            .map(LyricOccurrence::getLyric);

    LyricMatchStrategy OTHER_STAFF_SAME_LINE = (candidates, staffId, line) -> candidates.stream()
            .filter(o -> o.getStaffId() != staffId && o.getLine() == line)
            .findFirst()
            .map(LyricOccurrence::getLyric);

    LyricMatchStrategy OTHER_STAFF = (candidates, staffId, line) -> candidates.stream()
            .filter(o -> o.getStaffId() != staffId)
            .findFirst()
            .map(LyricOccurrence::getLyric);

    /** Lookup for a lyric at the chord's own position. */
    List<LyricMatchStrategy> DIRECT = List.of(
            UPPER_STAFF_SECOND_VERSE, SAME_STAFF_SAME_LINE, SAME_STAFF, SAME_LINE, FIRST);

    /**
     * Lookup at the chord's own position on one copy of a split staff. A lyric sung on the
     * other line of the same staff stays with the copy that carries that line.
     */
    List<LyricMatchStrategy> SPLIT_DIRECT = List.of(
            UPPER_STAFF_SECOND_VERSE, SAME_STAFF_SAME_LINE, OTHER_STAFF_SAME_LINE, OTHER_STAFF);

    /** Lookup at a neighbouring position: only lyrics bound to this staff's line qualify. */
    List<LyricMatchStrategy> NEIGHBOUR = List.of(UPPER_STAFF_SECOND_VERSE, SAME_STAFF_SAME_LINE);

    static Optional<Lyric> firstMatch(List<LyricMatchStrategy> strategies, List<LyricOccurrence> candidates,
                                      int originalStaffId, int line) {
        if (candidates.isEmpty()) return Optional.empty();
        for (LyricMatchStrategy strategy : strategies) {
            Optional<Lyric> found = strategy.match(candidates, originalStaffId, line);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }
}
