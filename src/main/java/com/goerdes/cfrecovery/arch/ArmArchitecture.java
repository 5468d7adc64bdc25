package com.goerdes.cfrecovery.arch;

import com.goerdes.cfrecovery.model.ArchitectureType;
import com.goerdes.cfrecovery.model.FlowType;
import com.goerdes.cfrecovery.model.Statement;
import com.goerdes.cfrecovery.utils.OffsetUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalLong;
import java.util.Set;

/**
 * AArch32 and AArch64. Condition codes may be written as suffix ({@code beq})
 * or with a dot ({@code b.eq}).
 */
@Component
public class ArmArchitecture implements Architecture {

    private static final Set<String> CONDITIONS = Set.of(
            "eq", "ne", "cs", "hs", "cc", "lo", "mi", "pl", "vs", "vc", "hi", "ls", "ge", "lt", "gt", "le", "al");

    private static final Set<String> COMPARE_AND_BRANCH = Set.of("cbz", "cbnz", "tbz", "tbnz");

    private static final Set<String> CALLS = Set.of("bl", "blx", "blr", "blraa", "blrab");

    private static final Set<String> INDIRECT_JUMPS = Set.of("br", "bx", "braa", "brab");

    @Override
    public ArchitectureType type() {
        return ArchitectureType.ARM;
    }

    @Override
    public FlowType flowType(Statement statement) {
        String mnemonic = statement.mnemonic().toLowerCase(Locale.ROOT);
        if (mnemonic.equals("b") || mnemonic.equals("b.al") || mnemonic.equals("bal")) {
            return FlowType.JUMP;
        }
        if (CALLS.contains(mnemonic)) {
            return FlowType.CALL;
        }
        if (mnemonic.equals("ret") || mnemonic.startsWith("reta")) {
            return FlowType.RETURN;
        }
        if (INDIRECT_JUMPS.contains(mnemonic)) {
            return statement.args().trim().equalsIgnoreCase("lr") ? FlowType.RETURN : FlowType.JUMP;
        }
        if (COMPARE_AND_BRANCH.contains(mnemonic)) {
            return FlowType.CONDITIONAL_JUMP;
        }
        if (mnemonic.startsWith("b.") && CONDITIONS.contains(mnemonic.substring(2))) {
            return FlowType.CONDITIONAL_JUMP;
        }
        if (mnemonic.length() == 3 && mnemonic.charAt(0) == 'b' && CONDITIONS.contains(mnemonic.substring(1))) {
            return FlowType.CONDITIONAL_JUMP;
        }
        return FlowType.SEQUENTIAL;
    }

    @Override
    public OptionalLong branchTarget(Statement statement) {
        String args = statement.args().trim();
        if (args.isEmpty()) {
            return OptionalLong.empty();
        }
        String[] operands = args.split(",");
        String last = operands[operands.length - 1].trim();
        // symbolized listings append the label: "b.ne 0x400560 <loop+8>"
        int symbol = last.indexOf(' ');
        return OffsetUtils.parseLiteral(symbol < 0 ? last : last.substring(0, symbol));
    }
}
