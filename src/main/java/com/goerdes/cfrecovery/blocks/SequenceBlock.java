package com.goerdes.cfrecovery.blocks;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Blocks executed one after the other. Nested sequences are flattened on
 * construction, so no child of a sequence is itself a sequence.
 * <p>
 * Only the two blocks the sequence was built from are owned by it. When one of
 * them is a sequence, its children appear here by reference but stay owned by
 * that inner sequence.
 */
public final class SequenceBlock extends AbstractBlock {

    private final List<AbstractBlock> components = new ArrayList<>();

    private final List<AbstractBlock> disposal = new ArrayList<>(2);

    public SequenceBlock(int id, AbstractBlock first, AbstractBlock second) {
        super(id);
        requireNonNull(first, "first");
        requireNonNull(second, "second");
        if (first == second) {
            throw new IllegalArgumentException("block " + first.getId() + " cannot follow itself in a sequence");
        }
        merge(first);
        merge(second);
    }

    private void merge(AbstractBlock block) {
        if (block.getType() == BlockType.SEQUENCE) {
            for (int i = 0; i < block.size(); i++) {
                components.add(block.child(i));
            }
        } else {
            components.add(block);
        }
        disposal.add(adopt(block));
    }

    @Override
    public BlockType getType() {
        return BlockType.SEQUENCE;
    }

    @Override
    public int size() {
        return components.size();
    }

    @Override
    public AbstractBlock child(int index) {
        checkIndex(index);
        return components.get(index);
    }

    @Override
    public BasicBlock entry() {
        return components.get(0).entry();
    }

    @Override
    List<AbstractBlock> disposalList() {
        return disposal;
    }
}
