package ai.legaldoc.reviser.diff;

import org.eclipse.jgit.diff.SequenceComparator;

/**
 * Equality of block keys for JGit's diff algorithms.
 */
final class BlockKeyComparator extends SequenceComparator<BlockKeySequence> {

    static final BlockKeyComparator INSTANCE = new BlockKeyComparator();

    @Override
    public boolean equals(BlockKeySequence a, int ai, BlockKeySequence b, int bi) {
        return a.get(ai).equals(b.get(bi));
    }

    @Override
    public int hash(BlockKeySequence sequence, int index) {
        return sequence.get(index).hashCode();
    }
}
