package com.goerdes.cfrecovery.blocks;

import com.goerdes.cfrecovery.exception.MalformedStructureException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Two-way conditional {@code if (cond) then else}. When the condition is a
 * short-circuit expression compiled into several conditional blocks, the
 * blocks between {@code head} and {@code then} form the chain.
 * <p>
 * Children: 0 is the head, 1 the then branch, 2 the else branch, from 3 on
 * the chain in evaluation order.
 */
public final class IfElseBlock extends AbstractBlock {

    private final BasicBlock head;

    private final AbstractBlock then;

    private final AbstractBlock otherwise;

    private final List<BasicBlock> chain;

    public IfElseBlock(int id, BasicBlock head, AbstractBlock then, AbstractBlock otherwise) {
        super(id);
        requireNonNull(head, "head");
        requireNonNull(then, "then");
        requireNonNull(otherwise, "else");
        this.chain = Collections.unmodifiableList(resolveChain(head, then.entry(), otherwise.entry()));
        this.head = adopt(head);
        this.then = adopt(then);
        this.otherwise = adopt(otherwise);
        chain.forEach(this::adopt);
    }

    /**
     * Walks from the head along the edge not leading to the else branch until
     * the then branch is reached. Every block met in between belongs to the chain.
     */
    private List<BasicBlock> resolveChain(BasicBlock head, BasicBlock thenEntry, BasicBlock elseEntry) {
        List<BasicBlock> blocks = new ArrayList<>();
        Set<BasicBlock> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(head);
        BasicBlock current = head;
        BasicBlock next = continuation(current, elseEntry);
        while (next != thenEntry) {
            if (next == null) {
                throw new MalformedStructureException("chain of if-else " + getId() + " ends at " + current + " before reaching " + thenEntry);
            }
            if (next == elseEntry) {
                throw new MalformedStructureException("both edges of " + current + " lead to the else branch of if-else " + getId());
            }
            if (!visited.add(next)) {
                throw new MalformedStructureException("chain of if-else " + getId() + " loops back to " + next);
            }
            blocks.add(next);
            current = next;
            next = continuation(current, elseEntry);
        }
        return blocks;
    }

    private static BasicBlock continuation(BasicBlock block, BasicBlock elseEntry) {
        return block.getNext() != elseEntry ? block.getNext() : block.getCond();
    }

    @Override
    public BlockType getType() {
        return BlockType.IF_ELSE;
    }

    @Override
    public int size() {
        return 3 + chain.size();
    }

    @Override
    public AbstractBlock child(int index) {
        checkIndex(index);
        return switch (index) {
            case 0 -> head;
            case 1 -> then;
            case 2 -> otherwise;
            default -> chain.get(index - 3);
        };
    }

    @Override
    public BasicBlock entry() {
        return head;
    }

    @Override
    List<AbstractBlock> disposalList() {
        List<AbstractBlock> disposal = new ArrayList<>(3 + chain.size());
        disposal.add(otherwise);
        disposal.add(then);
        disposal.add(head);
        disposal.addAll(chain);
        return disposal;
    }

    public BasicBlock getHead() {
        return head;
    }

    public AbstractBlock getThen() {
        return then;
    }

    public AbstractBlock getElse() {
        return otherwise;
    }

    /**
     * @return the intermediate condition blocks, first evaluated first
     */
    public List<BasicBlock> getChain() {
        return chain;
    }
}
