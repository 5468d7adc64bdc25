package com.goerdes.cfrecovery.blocks;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.goerdes.cfrecovery.utils.TestUtils.leaf;
import static org.junit.jupiter.api.Assertions.*;

class SequenceBlockTest {

    @Test
    void testTwoLeaves() {
        BasicBlock a = leaf(0);
        BasicBlock b = leaf(1);
        SequenceBlock sequence = new SequenceBlock(2, a, b);

        assertEquals(BlockType.SEQUENCE, sequence.getType());
        assertEquals(2, sequence.size());
        assertSame(a, sequence.child(0));
        assertSame(b, sequence.child(1));
        assertSame(a, sequence.entry());
        assertSame(sequence, a.getOwner().orElseThrow());
    }

    @Test
    void testNestedSequencesAreFlattened() {
        BasicBlock a = leaf(0);
        BasicBlock b = leaf(1);
        BasicBlock c = leaf(2);
        BasicBlock d = leaf(3);
        SequenceBlock s1 = new SequenceBlock(4, a, b);
        SequenceBlock s2 = new SequenceBlock(5, s1, c);
        SequenceBlock s3 = new SequenceBlock(6, d, s2);

        assertEquals(3, s2.size());
        assertEquals(List.of(a, b, c), s2.children());
        assertEquals(List.of(d, a, b, c), s3.children());
        assertTrue(s3.children().stream().noneMatch(child -> child.getType() == BlockType.SEQUENCE));
    }

    @Test
    void testFlattenedChildrenStayOwnedByInnerSequence() {
        BasicBlock a = leaf(0);
        BasicBlock b = leaf(1);
        BasicBlock c = leaf(2);
        SequenceBlock s1 = new SequenceBlock(3, a, b);
        SequenceBlock s2 = new SequenceBlock(4, s1, c);

        assertSame(s1, a.getOwner().orElseThrow());
        assertSame(s1, b.getOwner().orElseThrow());
        assertSame(s2, s1.getOwner().orElseThrow());
        assertSame(s2, c.getOwner().orElseThrow());
        assertTrue(s2.getOwner().isEmpty());
    }

    @Test
    void testReleaseFreesEveryBlockOnce() {
        BasicBlock a = leaf(0);
        BasicBlock b = leaf(1);
        BasicBlock c = leaf(2);
        SequenceBlock s1 = new SequenceBlock(3, a, b);
        SequenceBlock s2 = new SequenceBlock(4, s1, c);

        // a second release of any block would throw
        assertDoesNotThrow(s2::release);
        for (AbstractBlock block : List.of(s2, s1, a, b, c)) {
            assertTrue(block.isReleased(), block + " not released");
        }
        assertThrows(IllegalStateException.class, a::release);
    }

    @Test
    void testBlockCannotJoinTwoSequences() {
        BasicBlock a = leaf(0);
        BasicBlock b = leaf(1);
        BasicBlock c = leaf(2);
        new SequenceBlock(3, a, b);
        assertThrows(IllegalStateException.class, () -> new SequenceBlock(4, a, c));
    }

    @Test
    void testInvalidInputs() {
        BasicBlock a = leaf(0);
        assertThrows(NullPointerException.class, () -> new SequenceBlock(1, a, null));
        assertThrows(IllegalArgumentException.class, () -> new SequenceBlock(1, a, a));
    }

    @Test
    void testChildOutOfRange() {
        SequenceBlock sequence = new SequenceBlock(2, leaf(0), leaf(1));
        assertThrows(IndexOutOfBoundsException.class, () -> sequence.child(2));
        assertThrows(IndexOutOfBoundsException.class, () -> sequence.child(-1));
    }
}
