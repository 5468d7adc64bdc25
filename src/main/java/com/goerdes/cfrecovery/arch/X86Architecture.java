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
 * x86 and x86-64 in Intel or AT&amp;T mnemonic spelling.
 */
@Component
public class X86Architecture implements Architecture {

    private static final Set<String> PREFIXES = Set.of("bnd", "notrack", "rep", "repe", "repz", "repne", "repnz", "lock");

    private static final Set<String> JUMPS = Set.of("jmp", "jmpq", "ljmp");

    private static final Set<String> CALLS = Set.of("call", "callq", "lcall");

    private static final Set<String> RETURNS = Set.of("ret", "retq", "retn", "retf", "lret", "iret", "iretd", "iretq", "hlt", "ud2");

    @Override
    public ArchitectureType type() {
        return ArchitectureType.X86;
    }

    @Override
    public FlowType flowType(Statement statement) {
        String mnemonic = strip(statement).mnemonic().toLowerCase(Locale.ROOT);
        if (JUMPS.contains(mnemonic)) {
            return FlowType.JUMP;
        }
        if (CALLS.contains(mnemonic)) {
            return FlowType.CALL;
        }
        if (RETURNS.contains(mnemonic)) {
            return FlowType.RETURN;
        }
        if (mnemonic.startsWith("j") || mnemonic.startsWith("loop")) {
            return FlowType.CONDITIONAL_JUMP;
        }
        return FlowType.SEQUENTIAL;
    }

    @Override
    public OptionalLong branchTarget(Statement statement) {
        String args = strip(statement).args().trim();
        if (args.isEmpty()) {
            return OptionalLong.empty();
        }
        // objdump appends the symbol: "jmp 0x4005d0 <main+32>"
        return OffsetUtils.parseLiteral(args.split("\\s+")[0]);
    }

    /** Drops instruction prefixes so the real mnemonic comes first. */
    private static Statement strip(Statement statement) {
        Statement current = statement;
        while (PREFIXES.contains(current.mnemonic().toLowerCase(Locale.ROOT)) && !current.args().isBlank()) {
            current = new Statement(current.offset(), current.args().trim());
        }
        return current;
    }
}
