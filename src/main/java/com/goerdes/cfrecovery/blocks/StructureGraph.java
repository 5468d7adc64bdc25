package com.goerdes.cfrecovery.blocks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working graph of the structuring pass. Starts as a copy of the reachable
 * part of a {@link ControlFlowGraph} and shrinks as groups of nodes are
 * replaced by the structured block wrapping them.
 */
public final class StructureGraph {

    private AbstractBlock root;

    private final Map<AbstractBlock, List<AbstractBlock>> adjacency = new LinkedHashMap<>();

    private int nextId;

    private StructureGraph(int firstFreeId) {
        this.nextId = firstFreeId;
    }

    /**
     * Copies the blocks reachable from the entry of {@code cfg}.
     *
     * @param cfg the control flow graph
     * @return a graph whose nodes are the reachable basic blocks
     */
    public static StructureGraph from(ControlFlowGraph cfg) {
        StructureGraph graph = new StructureGraph(cfg.size());
        BasicBlock entry = cfg.getEntry();
        if (entry == null) {
            return graph;
        }
        graph.root = entry;
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(entry);
        while (!stack.isEmpty()) {
            BasicBlock block = stack.pop();
            if (!graph.adjacency.containsKey(block)) {
                List<BasicBlock> successors = block.successors();
                graph.adjacency.put(block, new ArrayList<>(successors));
                successors.forEach(stack::push);
            }
        }
        return graph;
    }

    /**
     * @return the node control enters first, {@code null} for an empty graph
     */
    public AbstractBlock getRoot() {
        return root;
    }

    public List<AbstractBlock> children(AbstractBlock node) {
        return Collections.unmodifiableList(adjacency.getOrDefault(node, List.of()));
    }

    public Set<AbstractBlock> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public int size() {
        return adjacency.size();
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    /**
     * @return {@code true} once the whole function collapsed into a single block
     */
    public boolean isReduced() {
        return adjacency.size() == 1;
    }

    /**
     * @return a fresh block id, continuing after the ids of the basic blocks
     */
    public int nextId() {
        return nextId++;
    }

    /**
     * @return for every node the set of nodes with an edge to it
     */
    public Map<AbstractBlock, Set<AbstractBlock>> predecessors() {
        Map<AbstractBlock, Set<AbstractBlock>> preds = new HashMap<>();
        adjacency.keySet().forEach(node -> preds.put(node, new LinkedHashSet<>()));
        adjacency.forEach((node, children) -> children.forEach(child -> preds.get(child).add(node)));
        return preds;
    }

    /**
     * @return the reachable nodes, every node after the nodes it leads to (back edges aside)
     */
    public List<AbstractBlock> postorder() {
        List<AbstractBlock> order = new ArrayList<>(adjacency.size());
        if (root == null) {
            return order;
        }
        Set<AbstractBlock> visited = new HashSet<>();
        Deque<AbstractBlock> stack = new ArrayDeque<>();
        Deque<Integer> position = new ArrayDeque<>();
        stack.push(root);
        position.push(0);
        visited.add(root);
        while (!stack.isEmpty()) {
            AbstractBlock node = stack.peek();
            int index = position.pop();
            List<AbstractBlock> children = adjacency.get(node);
            if (index < children.size()) {
                position.push(index + 1);
                AbstractBlock child = children.get(index);
                if (visited.add(child)) {
                    stack.push(child);
                    position.push(0);
                }
            } else {
                stack.pop();
                order.add(node);
            }
        }
        return order;
    }

    /**
     * Replaces {@code consumed} by {@code block}: edges into any consumed node
     * now point to {@code block}, whose only successor becomes {@code next}.
     * Nodes no longer reachable from the root are dropped.
     *
     * @param block    the structured block wrapping the consumed nodes
     * @param consumed the nodes absorbed by {@code block}
     * @param next     the successor of the new block, or {@code null}
     * @throws IllegalArgumentException if {@code next} is one of the consumed nodes
     */
    public void replace(AbstractBlock block, Collection<? extends AbstractBlock> consumed, AbstractBlock next) {
        Set<AbstractBlock> removed = new HashSet<>(consumed);
        if (next != null && removed.contains(next)) {
            throw new IllegalArgumentException("successor " + next + " of " + block + " is consumed by it");
        }
        Map<AbstractBlock, List<AbstractBlock>> remapped = new LinkedHashMap<>();
        adjacency.forEach((node, children) -> {
            if (!removed.contains(node)) {
                List<AbstractBlock> redirected = new ArrayList<>(children.size());
                for (AbstractBlock child : children) {
                    AbstractBlock target = removed.contains(child) ? block : child;
                    if (!redirected.contains(target)) {
                        redirected.add(target);
                    }
                }
                remapped.put(node, redirected);
            }
        });
        remapped.put(block, next == null ? new ArrayList<>() : new ArrayList<>(List.of(next)));
        if (removed.contains(root)) {
            root = block;
        }
        adjacency.clear();
        adjacency.putAll(remapped);
        adjacency.keySet().retainAll(reachable());
    }

    private Set<AbstractBlock> reachable() {
        Set<AbstractBlock> seen = new HashSet<>();
        Deque<AbstractBlock> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AbstractBlock node = stack.pop();
            if (seen.add(node)) {
                adjacency.getOrDefault(node, List.of()).forEach(stack::push);
            }
        }
        return seen;
    }
}
