package com.goerdes.cfrecovery.blocks;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Basic blocks of one function in program order. The entry is the block of
 * the first statement; blocks not reachable from it are kept but nothing
 * links to them.
 */
public final class ControlFlowGraph {

    private static final ControlFlowGraph EMPTY = new ControlFlowGraph(List.of());

    private final List<BasicBlock> blocks;

    private final Map<Long, BasicBlock> byStartOffset = new HashMap<>();

    public ControlFlowGraph(List<BasicBlock> blocks) {
        this.blocks = List.copyOf(blocks);
        this.blocks.forEach(b -> byStartOffset.put(b.getStartOffset(), b));
    }

    public static ControlFlowGraph empty() {
        return EMPTY;
    }

    /**
     * @return the entry block, or {@code null} if the function has no statements
     */
    public BasicBlock getEntry() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    /**
     * Finds the block beginning at the given offset.
     *
     * @param offset start offset of the block
     * @return the block, or empty if no block starts there
     */
    public Optional<BasicBlock> blockAt(long offset) {
        return Optional.ofNullable(byStartOffset.get(offset));
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
