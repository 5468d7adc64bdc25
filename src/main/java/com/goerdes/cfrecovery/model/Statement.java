package com.goerdes.cfrecovery.model;

import static com.goerdes.cfrecovery.utils.OffsetUtils.toHex;
import static java.util.Objects.requireNonNull;

/**
 * A single disassembled instruction.
 *
 * @param offset      unsigned byte offset of the instruction
 * @param instruction the instruction as text, mnemonic first, e.g. {@code "mov eax, ebx"}
 */
public record Statement(long offset, String instruction) {

    /** Returned for indexed accesses past the end of a function. */
    public static final Statement EMPTY = new Statement(0L, "");

    public Statement {
        requireNonNull(instruction, "instruction");
    }

    /**
     * @return the text before the first space, or the whole instruction when it has no operands
     */
    public String mnemonic() {
        int space = instruction.indexOf(' ');
        return space < 0 ? instruction : instruction.substring(0, space);
    }

    /**
     * @return the text after the first space, empty when the instruction has no operands
     */
    public String args() {
        int space = instruction.indexOf(' ');
        return space < 0 ? "" : instruction.substring(space + 1);
    }

    public boolean isEmpty() {
        return instruction.isEmpty();
    }

    @Override
    public String toString() {
        return toHex(offset) + " " + instruction;
    }
}
