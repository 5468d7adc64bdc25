package com.goerdes.cfrecovery.blocks;

import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.ArchitectureType;
import com.goerdes.cfrecovery.model.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.goerdes.cfrecovery.utils.TestUtils.cfgBuilder;
import static org.junit.jupiter.api.Assertions.*;

class StructureGraphTest {

    private final ArchitectureInfo x86 = new ArchitectureInfo(ArchitectureType.X86, false, false, false, true);

    private ControlFlowGraph loop() {
        return cfgBuilder().build(List.of(
                new Statement(0x0, "nop"),
                new Statement(0x1, "dec ecx"),
                new Statement(0x2, "jnz 0x1"),
                new Statement(0x4, "ret")), x86);
    }

    @Test
    void testFrom() {
        ControlFlowGraph cfg = loop();
        StructureGraph graph = StructureGraph.from(cfg);

        BasicBlock entry = cfg.getEntry();
        BasicBlock body = cfg.blockAt(0x1).orElseThrow();
        BasicBlock exit = cfg.blockAt(0x4).orElseThrow();
        assertSame(entry, graph.getRoot());
        assertEquals(3, graph.size());
        assertEquals(List.of(exit, body), graph.children(body));
        assertEquals(List.of(exit, body, entry), graph.postorder());
        assertEquals(cfg.size(), graph.nextId());
    }

    @Test
    void testReplace() {
        ControlFlowGraph cfg = cfgBuilder().build(List.of(
                new Statement(0, "call 0x100"),
                new Statement(5, "call 0x200"),
                new Statement(10, "ret")), x86);
        StructureGraph graph = StructureGraph.from(cfg);
        BasicBlock first = cfg.getEntry();
        BasicBlock second = cfg.blockAt(5).orElseThrow();
        BasicBlock last = cfg.blockAt(10).orElseThrow();

        SequenceBlock sequence = new SequenceBlock(graph.nextId(), first, second);
        graph.replace(sequence, List.of(first, second), last);

        assertSame(sequence, graph.getRoot());
        assertEquals(2, graph.size());
        assertEquals(List.of(last), graph.children(sequence));
        assertEquals(List.of(sequence), List.copyOf(graph.predecessors().get(last)));
    }

    @Test
    void testReplaceRejectsConsumedSuccessor() {
        ControlFlowGraph cfg = loop();
        StructureGraph graph = StructureGraph.from(cfg);
        BasicBlock entry = cfg.getEntry();
        BasicBlock body = cfg.blockAt(0x1).orElseThrow();
        BasicBlock exit = cfg.blockAt(0x4).orElseThrow();

        IfThenBlock ifThen = new IfThenBlock(graph.nextId(), body, exit);
        assertThrows(IllegalArgumentException.class, () -> graph.replace(ifThen, List.of(body, exit), body));
        assertEquals(List.of(exit, body), graph.children(body));
    }
}
