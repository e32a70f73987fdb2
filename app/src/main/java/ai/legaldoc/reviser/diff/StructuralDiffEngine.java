package ai.legaldoc.reviser.diff;

import ai.legaldoc.reviser.model.Block;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.MyersDiff;

/**
 * Aligns two block sequences by projected text.
 *
 * <p>Paragraphs compare by trimmed text; on the new side modification markers are stripped first. Tables
 * compare only by presence. The returned regions are ordered, their old ranges partition
 * {@code [0, old.size())} and their new ranges partition {@code [0, new.size())}.</p>
 */
public class StructuralDiffEngine {

    private final DiffAlgorithm algorithm;

    public StructuralDiffEngine() {
        this(MyersDiff.INSTANCE);
    }

    public StructuralDiffEngine(DiffAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    }

    public List<DiffRegion> diff(List<Block> oldBlocks, List<Block> newBlocks) {
        BlockKeySequence oldKeys = BlockKeySequence.of(oldBlocks, false);
        BlockKeySequence newKeys = BlockKeySequence.of(newBlocks, true);
        EditList edits = algorithm.diff(BlockKeyComparator.INSTANCE, oldKeys, newKeys);

        List<DiffRegion> regions = new ArrayList<>(edits.size() * 2 + 1);
        int oldPos = 0;
        int newPos = 0;
        for (Edit edit : edits) {
            if (edit.getType() == Edit.Type.EMPTY) {
                continue;
            }
            if (edit.getBeginA() > oldPos) {
                regions.add(new DiffRegion(RegionType.EQUAL, oldPos, edit.getBeginA(), newPos, edit.getBeginB()));
            }
            regions.add(new DiffRegion(toRegionType(edit.getType()),
                    edit.getBeginA(), edit.getEndA(), edit.getBeginB(), edit.getEndB()));
            oldPos = edit.getEndA();
            newPos = edit.getEndB();
        }
        if (oldPos < oldKeys.size()) {
            regions.add(new DiffRegion(RegionType.EQUAL, oldPos, oldKeys.size(), newPos, newKeys.size()));
        }
        return regions;
    }

    private RegionType toRegionType(Edit.Type type) {
        return switch (type) {
            case INSERT -> RegionType.INSERT;
            case DELETE -> RegionType.DELETE;
            case REPLACE -> RegionType.REPLACE;
            case EMPTY -> throw new IllegalArgumentException("Empty edits carry no region");
        };
    }
}
