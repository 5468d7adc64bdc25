package com.goerdes.cfrecovery.utils;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of instruction offsets. Offsets are unsigned 64-bit
 * values carried in a {@code long}.
 */
public final class OffsetUtils {

    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern DEC = Pattern.compile("[0-9]+");

    private OffsetUtils() {
    }

    /**
     * Parses an offset written either in hexadecimal with a {@code 0x}/{@code 0X}
     * prefix or in decimal.
     *
     * @param token the offset literal
     * @return the offset as unsigned long
     * @throws NumberFormatException if the token is neither form or overflows 64 bits
     */
    public static long parseOffset(String token) {
        if (HEX.matcher(token).matches()) {
            return Long.parseUnsignedLong(token.substring(2), 16);
        }
        if (DEC.matcher(token).matches()) {
            return Long.parseUnsignedLong(token);
        }
        throw new NumberFormatException("not an offset: '" + token + "'");
    }

    /**
     * Lenient variant of {@link #parseOffset(String)} used on branch operands:
     * an immediate marker ({@code #} or {@code $}) is skipped and anything that
     * is not a literal yields an empty result.
     *
     * @param operand the operand text
     * @return the literal offset, or empty for register and memory operands
     */
    public static OptionalLong parseLiteral(String operand) {
        String token = operand.trim();
        if (token.startsWith("#") || token.startsWith("$")) {
            token = token.substring(1);
        }
        try {
            return OptionalLong.of(parseOffset(token));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    /** Formats an offset the way disassemblers print it, e.g. {@code 0x4005d0}. */
    public static String toHex(long offset) {
        return "0x" + Long.toHexString(offset);
    }
}
