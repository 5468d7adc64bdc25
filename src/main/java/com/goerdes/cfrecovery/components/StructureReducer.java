package com.goerdes.cfrecovery.components;

import com.goerdes.cfrecovery.blocks.AbstractBlock;
import com.goerdes.cfrecovery.blocks.BasicBlock;
import com.goerdes.cfrecovery.blocks.ControlFlowGraph;
import com.goerdes.cfrecovery.blocks.IfElseBlock;
import com.goerdes.cfrecovery.blocks.IfThenBlock;
import com.goerdes.cfrecovery.blocks.SequenceBlock;
import com.goerdes.cfrecovery.blocks.StructureGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds a control flow graph into sequences, if-then and if-else blocks.
 * <p>
 * The graph is scanned in post-order and the first node matching one of the
 * patterns is replaced by the structured block; the scan then restarts on the
 * modified graph, until no pattern matches. Loops are left untouched, so a
 * function containing one does not reduce to a single block.
 */
@Component
public class StructureReducer {

    private static final Logger log = LoggerFactory.getLogger(StructureReducer.class);

    /**
     * Structures the reachable part of the given graph. The basic blocks of
     * {@code cfg} end up owned by the structured blocks created here.
     *
     * @param cfg the control flow graph of a function
     * @return the reduced graph; {@link StructureGraph#isReduced()} tells whether it collapsed into one block
     */
    public StructureGraph reduce(ControlFlowGraph cfg) {
        StructureGraph graph = StructureGraph.from(cfg);
        boolean modified = true;
        while (modified) {
            modified = false;
            Map<AbstractBlock, Set<AbstractBlock>> preds = graph.predecessors();
            for (AbstractBlock node : graph.postorder()) {
                Optional<Reduction> reduction = reduceSequence(node, graph, preds)
                        .or(() -> reduceIfThen(node, graph, preds))
                        .or(() -> reduceIfElse(node, graph, preds));
                if (reduction.isPresent()) {
                    Reduction r = reduction.get();
                    log.debug("Reduced {} into {}", r.consumed(), r.block());
                    graph.replace(r.block(), r.consumed(), r.next());
                    modified = true;
                    break;
                }
            }
        }
        if (!graph.isEmpty() && !graph.isReduced()) {
            log.warn("Structuring stopped with {} blocks left", graph.size());
        }
        return graph;
    }

    /**
     * A node with a single successor that is entered only from it and has at
     * most one successor itself.
     */
    private Optional<Reduction> reduceSequence(AbstractBlock node, StructureGraph graph,
                                               Map<AbstractBlock, Set<AbstractBlock>> preds) {
        List<AbstractBlock> children = graph.children(node);
        if (children.size() != 1) {
            return Optional.empty();
        }
        AbstractBlock next = children.get(0);
        if (next == node || next == graph.getRoot() || preds.get(next).size() != 1) {
            return Optional.empty();
        }
        List<AbstractBlock> nextChildren = graph.children(next);
        if (nextChildren.size() > 1 || nextChildren.contains(node) || nextChildren.contains(next)) {
            return Optional.empty();
        }
        SequenceBlock sequence = new SequenceBlock(graph.nextId(), node, next);
        return Optional.of(new Reduction(sequence, List.of(node, next), nextChildren.isEmpty() ? null : nextChildren.get(0)));
    }

    /**
     * A condition whose one branch is entered only from it and rejoins the other.
     */
    private Optional<Reduction> reduceIfThen(AbstractBlock node, StructureGraph graph,
                                             Map<AbstractBlock, Set<AbstractBlock>> preds) {
        List<AbstractBlock> children = graph.children(node);
        if (!(node instanceof BasicBlock head) || children.size() != 2) {
            return Optional.empty();
        }
        for (int i = 0; i < 2; i++) {
            AbstractBlock then = children.get(i);
            AbstractBlock cont = children.get(1 - i);
            if (cont != node && isBranch(then, node, graph, preds) && graph.children(then).equals(List.of(cont))) {
                IfThenBlock block = new IfThenBlock(graph.nextId(), head, then);
                return Optional.of(new Reduction(block, List.of(head, then), cont));
            }
        }
        return Optional.empty();
    }

    /**
     * A condition whose two branches rejoin at the same block, or both leave
     * the function. Conditions above it that also jump to the else branch are
     * collected as the chain of a short-circuit expression.
     */
    private Optional<Reduction> reduceIfElse(AbstractBlock node, StructureGraph graph,
                                             Map<AbstractBlock, Set<AbstractBlock>> preds) {
        List<AbstractBlock> children = graph.children(node);
        if (!(node instanceof BasicBlock) || children.size() != 2) {
            return Optional.empty();
        }
        for (int i = 0; i < 2; i++) {
            AbstractBlock then = children.get(i);
            AbstractBlock otherwise = children.get(1 - i);
            if (!isBranch(then, node, graph, preds) || otherwise == node || otherwise == graph.getRoot()) {
                continue;
            }
            List<AbstractBlock> thenChildren = graph.children(then);
            List<AbstractBlock> elseChildren = graph.children(otherwise);
            if (thenChildren.size() > 1 || !thenChildren.equals(elseChildren) || thenChildren.contains(node)) {
                continue;
            }
            List<BasicBlock> heads = ascendChain((BasicBlock) node, otherwise, graph, preds);
            if (!preds.get(otherwise).equals(new HashSet<>(heads))) {
                continue;
            }
            // a merge block inside the chain closes a loop around the conditional
            if (!thenChildren.isEmpty() && heads.contains(thenChildren.get(0))) {
                continue;
            }
            BasicBlock top = heads.get(heads.size() - 1);
            IfElseBlock block = new IfElseBlock(graph.nextId(), top, then, otherwise);
            List<AbstractBlock> consumed = new ArrayList<>(heads);
            consumed.add(then);
            consumed.add(otherwise);
            return Optional.of(new Reduction(block, consumed, thenChildren.isEmpty() ? null : thenChildren.get(0)));
        }
        return Optional.empty();
    }

    /**
     * Collects {@code innermost} and the conditions leading to it, innermost
     * first. Each added condition is the only predecessor of the previous one
     * and has the else branch as its other successor.
     */
    private List<BasicBlock> ascendChain(BasicBlock innermost, AbstractBlock otherwise, StructureGraph graph,
                                         Map<AbstractBlock, Set<AbstractBlock>> preds) {
        List<BasicBlock> heads = new ArrayList<>();
        heads.add(innermost);
        BasicBlock current = innermost;
        while (current != graph.getRoot() && preds.get(current).size() == 1) {
            AbstractBlock pred = preds.get(current).iterator().next();
            if (!(pred instanceof BasicBlock condition) || heads.contains(condition)) {
                break;
            }
            List<AbstractBlock> predChildren = graph.children(condition);
            if (predChildren.size() != 2 || !predChildren.contains(current) || !predChildren.contains(otherwise)) {
                break;
            }
            heads.add(condition);
            current = condition;
        }
        return heads;
    }

    /** Whether {@code branch} is a node entered only from {@code condition}. */
    private static boolean isBranch(AbstractBlock branch, AbstractBlock condition, StructureGraph graph,
                                    Map<AbstractBlock, Set<AbstractBlock>> preds) {
        return branch != condition && branch != graph.getRoot() && preds.get(branch).size() == 1;
    }

    /**
     * Outcome of a matched pattern.
     *
     * @param block    the structured block replacing the matched nodes
     * @param consumed the matched nodes
     * @param next     the successor of the new block, {@code null} if it leaves the function
     */
    private record Reduction(AbstractBlock block, List<AbstractBlock> consumed, AbstractBlock next) {}
}
