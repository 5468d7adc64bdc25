package com.goerdes.cfrecovery.blocks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Node of the structured block tree. Leaves are {@link BasicBlock}s, inner
 * nodes are the structured constructs built on top of them.
 * <p>
 * The visible children ({@link #size()}, {@link #child(int)}) are not
 * necessarily the blocks a node is responsible for: a sequence exposes the
 * flattened children of nested sequences but only owns the sequences it was
 * built from. Every block has at most one owner and {@link #release()} walks
 * ownership, never the visible children, so each block is released once.
 */
public abstract class AbstractBlock {

    private final int id;

    private AbstractBlock owner;

    private boolean released;

    AbstractBlock(int id) {
        this.id = id;
    }

    /**
     * @return identifier of this block, unique within one analysis
     */
    public int getId() {
        return id;
    }

    public abstract BlockType getType();

    /**
     * @return number of logical children
     */
    public abstract int size();

    /**
     * Returns the {@code index}-th logical child.
     *
     * @param index value in {@code [0, size())}
     * @return the child block
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public abstract AbstractBlock child(int index);

    /**
     * @return the leaf through which control enters this block
     */
    public abstract BasicBlock entry();

    /**
     * @return the blocks released together with this one
     */
    abstract List<AbstractBlock> disposalList();

    public List<AbstractBlock> children() {
        List<AbstractBlock> children = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            children.add(child(i));
        }
        return Collections.unmodifiableList(children);
    }

    public Optional<AbstractBlock> getOwner() {
        return Optional.ofNullable(owner);
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Releases this block and, recursively, every block it owns.
     *
     * @throws IllegalStateException if the block was already released
     */
    public void release() {
        if (released) {
            throw new IllegalStateException("block " + id + " released twice");
        }
        released = true;
        for (AbstractBlock block : disposalList()) {
            block.release();
        }
        onRelease();
    }

    /** Hook for subclasses dropping their own references once released. */
    void onRelease() {
    }

    /**
     * Takes ownership of {@code block}.
     *
     * @return the adopted block
     * @throws IllegalStateException if the block already has an owner or was released
     */
    <T extends AbstractBlock> T adopt(T block) {
        AbstractBlock adopted = requireNonNull(block, "block");
        if (adopted.owner != null) {
            throw new IllegalStateException("block " + adopted.id + " is already owned by block " + adopted.owner.id);
        }
        if (adopted.released) {
            throw new IllegalStateException("block " + adopted.id + " was already released");
        }
        adopted.owner = this;
        return block;
    }

    void checkIndex(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for block " + id + " of size " + size());
        }
    }

    @Override
    public String toString() {
        return getType() + "#" + id;
    }
}
