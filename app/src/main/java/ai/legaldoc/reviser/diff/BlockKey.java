package ai.legaldoc.reviser.diff;

import ai.legaldoc.reviser.model.BlockKind;

/**
 * Comparison key of a block. Tables carry an empty text, so they match any other table and no paragraph.
 */
record BlockKey(BlockKind kind, String text) {
}
