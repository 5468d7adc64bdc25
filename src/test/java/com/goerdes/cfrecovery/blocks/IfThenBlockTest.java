package com.goerdes.cfrecovery.blocks;

import org.junit.jupiter.api.Test;

import static com.goerdes.cfrecovery.utils.TestUtils.leaf;
import static org.junit.jupiter.api.Assertions.*;

class IfThenBlockTest {

    @Test
    void testChildren() {
        BasicBlock head = leaf(0);
        SequenceBlock then = new SequenceBlock(3, leaf(1), leaf(2));
        IfThenBlock block = new IfThenBlock(4, head, then);

        assertEquals(BlockType.IF_THEN, block.getType());
        assertEquals(2, block.size());
        assertSame(head, block.child(0));
        assertSame(then, block.child(1));
        assertSame(head, block.entry());
        assertThrows(IndexOutOfBoundsException.class, () -> block.child(2));
    }

    @Test
    void testSequenceInsideIfThenIsNotFlattened() {
        BasicBlock head = leaf(0);
        SequenceBlock then = new SequenceBlock(3, leaf(1), leaf(2));
        IfThenBlock block = new IfThenBlock(4, head, then);
        SequenceBlock outer = new SequenceBlock(6, block, leaf(5));

        assertEquals(2, outer.size());
        assertSame(block, outer.child(0));
        assertEquals(BlockType.SEQUENCE, block.child(1).getType());
    }

    @Test
    void testRelease() {
        BasicBlock head = leaf(0);
        BasicBlock then = leaf(1);
        IfThenBlock block = new IfThenBlock(2, head, then);

        block.release();

        assertTrue(block.isReleased());
        assertTrue(head.isReleased());
        assertTrue(then.isReleased());
    }
}
