package com.goerdes.cfrecovery.arch;

import com.goerdes.cfrecovery.model.ArchitectureType;
import com.goerdes.cfrecovery.model.FlowType;
import com.goerdes.cfrecovery.model.Statement;

import java.util.OptionalLong;

/**
 * Instruction-set specific knowledge needed to split a function into basic blocks.
 */
public interface Architecture {

    /**
     * @return the instruction set handled by this implementation
     */
    ArchitectureType type();

    /**
     * Classifies how the given statement passes control on.
     *
     * @param statement the statement to classify
     * @return the flow type, {@link FlowType#SEQUENTIAL} for ordinary instructions
     */
    FlowType flowType(Statement statement);

    /**
     * Extracts the destination of a jump.
     *
     * @param statement a statement classified as {@link FlowType#JUMP} or {@link FlowType#CONDITIONAL_JUMP}
     * @return the destination offset, or empty when the jump is indirect
     */
    OptionalLong branchTarget(Statement statement);

}
