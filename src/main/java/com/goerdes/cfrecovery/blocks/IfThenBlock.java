package com.goerdes.cfrecovery.blocks;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Conditional block without alternative: {@code if (head) then}.
 */
public final class IfThenBlock extends AbstractBlock {

    private final BasicBlock head;

    private final AbstractBlock then;

    public IfThenBlock(int id, BasicBlock head, AbstractBlock then) {
        super(id);
        this.head = adopt(requireNonNull(head, "head"));
        this.then = adopt(requireNonNull(then, "then"));
    }

    @Override
    public BlockType getType() {
        return BlockType.IF_THEN;
    }

    @Override
    public int size() {
        return 2;
    }

    @Override
    public AbstractBlock child(int index) {
        checkIndex(index);
        return index == 0 ? head : then;
    }

    @Override
    public BasicBlock entry() {
        return head;
    }

    @Override
    List<AbstractBlock> disposalList() {
        return List.of(head, then);
    }

    public BasicBlock getHead() {
        return head;
    }

    public AbstractBlock getThen() {
        return then;
    }
}
