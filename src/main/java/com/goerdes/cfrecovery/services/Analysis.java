package com.goerdes.cfrecovery.services;

import com.goerdes.cfrecovery.blocks.AbstractBlock;
import com.goerdes.cfrecovery.blocks.BasicBlock;
import com.goerdes.cfrecovery.blocks.ControlFlowGraph;
import com.goerdes.cfrecovery.blocks.StructureGraph;
import com.goerdes.cfrecovery.components.CfgBuilder;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.Statement;
import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Analysis of a single disassembled function.
 * <p>
 * Keeps the statements twice: in program order for indexed access and keyed
 * by offset for branch resolution. The control flow graph is built eagerly on
 * construction; structuring passes replace its root later on.
 */
public class Analysis {

    /** Statements in program order. */
    @Getter
    private final List<Statement> statements;

    /** The same statements keyed by offset. */
    private final Map<Long, Statement> statementsByOffset;

    /** Architecture of the binary the function belongs to. */
    @Getter
    private final ArchitectureInfo architecture;

    /** Basic blocks of the function as built from the statements. */
    @Getter
    private final ControlFlowGraph controlFlowGraph;

    private AbstractBlock root;

    private boolean released;

    /**
     * Builds the analysis of the given function.
     *
     * @param statements   the statements of the function in program order
     * @param architecture architecture of the binary; kept for the lifetime of the analysis
     * @param cfgBuilder   builder used to create the control flow graph
     * @throws com.goerdes.cfrecovery.exception.CfgConstructionException if the statements cannot be wired into a graph
     */
    public Analysis(List<Statement> statements, ArchitectureInfo architecture, CfgBuilder cfgBuilder) {
        this.statements = List.copyOf(requireNonNull(statements, "statements"));
        this.architecture = requireNonNull(architecture, "architecture");
        Map<Long, Statement> sparse = new HashMap<>();
        this.statements.forEach(s -> sparse.put(s.offset(), s));
        this.statementsByOffset = Collections.unmodifiableMap(sparse);
        this.controlFlowGraph = cfgBuilder.build(this.statements, architecture);
        this.root = controlFlowGraph.getEntry();
    }

    /**
     * Accesses the n-th statement. Expects an index, not an offset: the first
     * statement is found at 0 whatever its offset.
     *
     * @param index position of the statement in program order
     * @return the statement, or {@link Statement#EMPTY} if the index is out of bounds
     */
    public Statement statementAt(int index) {
        return index >= 0 && index < statements.size() ? statements.get(index) : Statement.EMPTY;
    }

    /**
     * @param offset byte offset of the statement
     * @return the statement at the given offset, if any
     */
    public Optional<Statement> statementAtOffset(long offset) {
        return Optional.ofNullable(statementsByOffset.get(offset));
    }

    /**
     * @return number of statements of the function
     */
    public int size() {
        return statements.size();
    }

    /**
     * Returns the root of the block tree: the entry basic block until a
     * structuring pass has been applied, the structured root afterwards.
     *
     * @return the root block, or {@code null} for a function without statements
     */
    public AbstractBlock getCfg() {
        return root;
    }

    /**
     * Installs the result of a structuring pass as the new root.
     *
     * @param structure the structured graph built from {@link #getControlFlowGraph()}
     */
    public void applyStructure(StructureGraph structure) {
        this.root = structure.getRoot();
    }

    /**
     * Releases every block of the function exactly once, structured or not,
     * reachable or not.
     *
     * @throws IllegalStateException if the analysis was already released
     */
    public void release() {
        if (released) {
            throw new IllegalStateException("analysis already released");
        }
        released = true;
        // blocks compare by identity, so each tree is released once
        Set<AbstractBlock> tops = new LinkedHashSet<>();
        for (BasicBlock block : controlFlowGraph.getBlocks()) {
            AbstractBlock top = block;
            while (top.getOwner().isPresent()) {
                top = top.getOwner().get();
            }
            tops.add(top);
        }
        tops.forEach(AbstractBlock::release);
    }

    public boolean isReleased() {
        return released;
    }
}
