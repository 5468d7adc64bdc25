package com.goerdes.cfrecovery.services;

import com.goerdes.cfrecovery.blocks.AbstractBlock;
import com.goerdes.cfrecovery.blocks.BlockType;
import com.goerdes.cfrecovery.blocks.IfElseBlock;
import com.goerdes.cfrecovery.exception.StatementParseException;
import com.goerdes.cfrecovery.model.ArchitectureInfo;
import com.goerdes.cfrecovery.model.ArchitectureType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;

import static com.goerdes.cfrecovery.utils.TestUtils.getFunction;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AnalysisServiceTest {

    private static final ArchitectureInfo X86_64 = new ArchitectureInfo(ArchitectureType.X86, false, true, false, true);

    @Autowired
    private AnalysisService analysisService;

    @Test
    void testIfElse() throws IOException {
        Analysis analysis = analysisService.analyze(getFunction("functions/max.txt"), X86_64);

        assertEquals(7, analysis.size());
        assertEquals(4, analysis.getControlFlowGraph().size());
        AbstractBlock root = analysis.getCfg();
        assertEquals(BlockType.SEQUENCE, root.getType());
        assertEquals(BlockType.IF_ELSE, root.child(0).getType());
        assertEquals(BlockType.BASIC, root.child(1).getType());
        analysis.release();
    }

    @Test
    void testShortCircuitCondition() throws IOException {
        Analysis analysis = analysisService.analyze(getFunction("functions/in_range.txt"), X86_64);

        IfElseBlock condition = assertInstanceOf(IfElseBlock.class, analysis.getCfg().child(0));
        assertEquals(1, condition.getChain().size());
        assertEquals(0x401147, condition.getChain().get(0).getStartOffset());
        assertSame(analysis.getControlFlowGraph().blockAt(0x40114c).orElseThrow(), condition.getThen());
        assertSame(analysis.getControlFlowGraph().blockAt(0x401156).orElseThrow(), condition.getElse());
    }

    @Test
    void testLoopStaysUnstructured() throws IOException {
        Analysis analysis = analysisService.analyze(getFunction("functions/count_down.txt"), X86_64);

        assertSame(analysis.getControlFlowGraph().getEntry(), analysis.getCfg());
        assertEquals(3, analysis.getControlFlowGraph().size());
    }

    @Test
    void testArchitectureJson() throws IOException {
        Analysis analysis = analysisService.analyze(getFunction("functions/abs_arm.txt"),
                "{\"arch\":\"arm\",\"bits_64\":true}");

        assertEquals(ArchitectureType.ARM, analysis.getArchitecture().arch());
        assertTrue(analysis.getArchitecture().is64bit());
        assertEquals(BlockType.SEQUENCE, analysis.getCfg().getType());
        assertEquals(BlockType.IF_THEN, analysis.getCfg().child(0).getType());
    }

    @Test
    void testMalformedListing() {
        StatementParseException e = assertThrows(StatementParseException.class,
                () -> analysisService.analyze("f:\n0x0 nop\nnonsense\n", X86_64));
        assertEquals(3, e.getLine());
    }

    @Test
    void testEmptyFunction() {
        Analysis analysis = analysisService.analyze("f:\n", X86_64);
        assertNull(analysis.getCfg());
        assertTrue(analysis.getControlFlowGraph().isEmpty());
    }
}
