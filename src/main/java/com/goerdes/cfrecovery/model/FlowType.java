package com.goerdes.cfrecovery.model;

/**
 * How an instruction hands control to the following ones.
 */
public enum FlowType {

    /** Execution continues with the next instruction. */
    SEQUENTIAL,

    /** A call: execution resumes after it, but it ends a basic block. */
    CALL,

    /** Unconditional transfer to the branch target. */
    JUMP,

    /** Transfer to the branch target if a condition holds, fallthrough otherwise. */
    CONDITIONAL_JUMP,

    /** Leaves the function (return, halt, trap). */
    RETURN;

    public boolean endsBlock() {
        return this != SEQUENTIAL;
    }

    public boolean isJump() {
        return this == JUMP || this == CONDITIONAL_JUMP;
    }
}
