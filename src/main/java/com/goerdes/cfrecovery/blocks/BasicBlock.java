package com.goerdes.cfrecovery.blocks;

import com.goerdes.cfrecovery.model.Statement;

import java.util.ArrayList;
import java.util.List;

import static com.goerdes.cfrecovery.utils.OffsetUtils.toHex;

/**
 * Maximal straight-line run of statements. Leaves the block through at most
 * two edges: {@code next}, the fallthrough or unconditional destination, and
 * {@code cond}, the destination taken when a conditional jump holds.
 */
public final class BasicBlock extends AbstractBlock {

    private final List<Statement> statements;

    private BasicBlock next;

    private BasicBlock cond;

    public BasicBlock(int id, List<Statement> statements) {
        super(id);
        this.statements = List.copyOf(statements);
    }

    @Override
    public BlockType getType() {
        return BlockType.BASIC;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public AbstractBlock child(int index) {
        throw new IndexOutOfBoundsException("basic block " + getId() + " has no children, index " + index);
    }

    @Override
    public BasicBlock entry() {
        return this;
    }

    @Override
    List<AbstractBlock> disposalList() {
        return List.of();
    }

    @Override
    void onRelease() {
        next = null;
        cond = null;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /**
     * @return offset of the first statement, 0 for a synthetic empty block
     */
    public long getStartOffset() {
        return statements.isEmpty() ? 0L : statements.get(0).offset();
    }

    /**
     * @return offset of the last statement, 0 for a synthetic empty block
     */
    public long getEndOffset() {
        return statements.isEmpty() ? 0L : statements.get(statements.size() - 1).offset();
    }

    public BasicBlock getNext() {
        return next;
    }

    public void setNext(BasicBlock next) {
        this.next = next;
    }

    public BasicBlock getCond() {
        return cond;
    }

    public void setCond(BasicBlock cond) {
        this.cond = cond;
    }

    /**
     * @return the distinct successors, {@code next} first
     */
    public List<BasicBlock> successors() {
        List<BasicBlock> successors = new ArrayList<>(2);
        if (next != null) {
            successors.add(next);
        }
        if (cond != null && cond != next) {
            successors.add(cond);
        }
        return successors;
    }

    @Override
    public String toString() {
        return "BASIC#" + getId() + "[" + toHex(getStartOffset()) + ".." + toHex(getEndOffset()) + "]";
    }
}
