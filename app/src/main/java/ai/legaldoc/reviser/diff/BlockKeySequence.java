package ai.legaldoc.reviser.diff;

import ai.legaldoc.reviser.article.LegalPatterns;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.BlockKind;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.jgit.diff.Sequence;

/**
 * Block keys exposed to JGit's diff algorithms.
 */
final class BlockKeySequence extends Sequence {

    private final List<BlockKey> keys;

    private BlockKeySequence(List<BlockKey> keys) {
        this.keys = keys;
    }

    /**
     * @param stripMarkers whether modification markers are removed from paragraph text, so that a
     *                     header flagged as modified still matches its unflagged counterpart
     */
    static BlockKeySequence of(List<Block> blocks, boolean stripMarkers) {
        List<BlockKey> keys = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            keys.add(keyOf(block, stripMarkers));
        }
        return new BlockKeySequence(keys);
    }

    static BlockKey keyOf(Block block, boolean stripMarkers) {
        return switch (block.kind()) {
            case TABLE -> new BlockKey(BlockKind.TABLE, "");
            case PARAGRAPH -> {
                String text = block.asParagraph().text().trim();
                if (stripMarkers) {
                    text = text.replace(String.valueOf(LegalPatterns.MODIFICATION_MARKER), "");
                }
                yield new BlockKey(BlockKind.PARAGRAPH, text);
            }
        };
    }

    BlockKey get(int index) {
        return keys.get(index);
    }

    @Override
    public int size() {
        return keys.size();
    }
}
