package com.goerdes.cfrecovery.components;

import com.goerdes.cfrecovery.arch.Architecture;
import com.goerdes.cfrecovery.blocks.BasicBlock;
import com.goerdes.cfrecovery.blocks.ControlFlowGraph;
import com.goerdes.cfrecovery.exception.CfgConstructionException;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.FlowType;
import com.goerdes.cfrecovery.model.Statement;
import com.goerdes.cfrecovery.services.ArchitectureRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;

import static com.goerdes.cfrecovery.utils.OffsetUtils.toHex;

/**
 * Splits the statements of a function into basic blocks and links them.
 * Branch destinations are looked up in an offset index, which keeps the whole
 * construction in O(n log n).
 */
@Component
@RequiredArgsConstructor
public class CfgBuilder {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    private final ArchitectureRegistry architectureRegistry;

    /**
     * Builds the control flow graph of a function.
     * <p>
     * A block ends after every jump, call and return, and a new one starts at
     * every jump destination. A jump whose operand is not a literal ends its
     * block without a taken edge.
     *
     * @param statements the statements of the function in program order
     * @param info       architecture of the binary, selects the branch classification
     * @return the graph, with the block of the first statement as entry
     * @throws CfgConstructionException if two statements share an offset or a
     *                                  jump targets an offset that is not a statement
     */
    public ControlFlowGraph build(List<Statement> statements, ArchitectureInfo info) {
        if (statements.isEmpty()) {
            return ControlFlowGraph.empty();
        }
        Architecture architecture = architectureRegistry.getArchitecture(info);
        int count = statements.size();

        NavigableMap<Long, Integer> index = new TreeMap<>(Long::compareUnsigned);
        for (int i = 0; i < count; i++) {
            Integer previous = index.put(statements.get(i).offset(), i);
            if (previous != null) {
                throw new CfgConstructionException("duplicate statement offset " + toHex(statements.get(i).offset()));
            }
        }

        FlowType[] flows = new FlowType[count];
        int[] targets = new int[count];
        Arrays.fill(targets, -1);
        boolean[] leaders = new boolean[count];
        leaders[0] = true;

        for (int i = 0; i < count; i++) {
            Statement statement = statements.get(i);
            flows[i] = architecture.flowType(statement);
            if (flows[i].endsBlock() && i + 1 < count) {
                leaders[i + 1] = true;
            }
            if (flows[i].isJump()) {
                OptionalLong target = architecture.branchTarget(statement);
                if (target.isEmpty()) {
                    log.warn("Indirect jump at {} ends its block without successor: {}", toHex(statement.offset()), statement.instruction());
                    continue;
                }
                Integer destination = index.get(target.getAsLong());
                if (destination == null) {
                    throw new CfgConstructionException("unresolved branch target " + toHex(target.getAsLong())
                            + " of '" + statement.instruction() + "' at " + toHex(statement.offset()));
                }
                targets[i] = destination;
                leaders[destination] = true;
            }
        }

        List<BasicBlock> blocks = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        int[] blockOf = new int[count];
        int start = 0;
        for (int i = 1; i <= count; i++) {
            if (i == count || leaders[i]) {
                for (int j = start; j < i; j++) {
                    blockOf[j] = blocks.size();
                }
                blocks.add(new BasicBlock(blocks.size(), statements.subList(start, i)));
                ends.add(i - 1);
                start = i;
            }
        }

        for (int b = 0; b < blocks.size(); b++) {
            BasicBlock block = blocks.get(b);
            int last = ends.get(b);
            BasicBlock fallthrough = last + 1 < count ? blocks.get(blockOf[last + 1]) : null;
            BasicBlock target = targets[last] >= 0 ? blocks.get(blockOf[targets[last]]) : null;
            switch (flows[last]) {
                case SEQUENTIAL, CALL -> block.setNext(fallthrough);
                case JUMP -> block.setNext(target);
                case CONDITIONAL_JUMP -> {
                    block.setNext(fallthrough);
                    block.setCond(target);
                }
                default -> {
                    // returns leave the function
                }
            }
        }

        log.debug("Built {} basic blocks from {} statements", blocks.size(), count);
        return new ControlFlowGraph(blocks);
    }
}
