package com.goerdes.cfrecovery.utils;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static com.goerdes.cfrecovery.utils.OffsetUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class OffsetUtilsTest {

    @Test
    void testParseOffset() {
        assertEquals(0x4005d0, parseOffset("0x4005d0"));
        assertEquals(0x4005d0, parseOffset("0X4005D0"));
        assertEquals(1234, parseOffset("1234"));
        assertEquals(-1L, parseOffset("0xffffffffffffffff"));
    }

    @Test
    void testParseOffsetRejectsGarbage() {
        assertThrows(NumberFormatException.class, () -> parseOffset("0x"));
        assertThrows(NumberFormatException.class, () -> parseOffset("12ab"));
        assertThrows(NumberFormatException.class, () -> parseOffset("-4"));
        assertThrows(NumberFormatException.class, () -> parseOffset("0x1ffffffffffffffff"));
    }

    @Test
    void testParseLiteral() {
        assertEquals(OptionalLong.of(8), parseLiteral("#8"));
        assertEquals(OptionalLong.of(0x10), parseLiteral(" 0x10 "));
        assertEquals(OptionalLong.empty(), parseLiteral("rax"));
    }

    @Test
    void testToHex() {
        assertEquals("0x10", toHex(16));
        assertEquals("0xffffffffffffffff", toHex(-1L));
    }
}
