package io.rtfde.core.diff;

import java.util.List;
import org.eclipse.jgit.diff.Sequence;
import org.eclipse.jgit.diff.SequenceComparator;

/**
 * Adapts a list of comparison units (lines, separator-delimited fields, flattened tree entries) to JGit's
 * {@link Sequence} so the JGit diff algorithms can run over it.
 */
final class UnitSequence extends Sequence {

    static final SequenceComparator<UnitSequence> COMPARATOR = new SequenceComparator<>() {
        @Override
        public boolean equals(UnitSequence a, int ai, UnitSequence b, int bi) {
            return a.get(ai).equals(b.get(bi));
        }

        @Override
        public int hash(UnitSequence seq, int ptr) {
            return seq.get(ptr).hashCode();
        }
    };

    private final List<String> units;

    UnitSequence(List<String> units) {
        this.units = units;
    }

    String get(int index) {
        return units.get(index);
    }

    List<String> slice(int begin, int end) {
        return units.subList(begin, end);
    }

    @Override
    public int size() {
        return units.size();
    }
}
