package com.goerdes.cfrecovery.components;

import com.goerdes.cfrecovery.exception.StatementParseException;
import com.goerdes.cfrecovery.model.Statement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.goerdes.cfrecovery.utils.OffsetUtils.parseOffset;

/**
 * Turns a textual function listing into statements.
 * <p>
 * The first line carries the function name and is skipped. Every further line
 * holds an offset, a single space and the instruction, e.g.
 * <pre>
 * main:
 * 0x4004d6 push rbp
 * 0x4004d7 mov rbp, rsp
 * </pre>
 * Offsets are hexadecimal when prefixed by {@code 0x} or {@code 0X}, decimal
 * otherwise. The whole listing is lower-cased and the instruction text is
 * stripped of surrounding whitespace.
 */
@Component
public class StatementParser {

    /**
     * Parses the given listing.
     *
     * @param function the listing, first line being the header
     * @return the statements in listing order
     * @throws StatementParseException if a line has no valid offset or no instruction
     */
    public List<Statement> parse(String function) {
        String[] lines = function.toLowerCase(Locale.ROOT).split("\\r?\\n");
        List<Statement> statements = new ArrayList<>(Math.max(0, lines.length - 1));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            statements.add(parseLine(line, i + 1));
        }
        return statements;
    }

    private Statement parseLine(String line, int lineNumber) {
        int space = line.indexOf(' ');
        if (space < 0) {
            throw new StatementParseException("missing instruction after offset '" + line + "'", lineNumber, null);
        }
        long offset;
        try {
            offset = parseOffset(line.substring(0, space));
        } catch (NumberFormatException e) {
            throw new StatementParseException("invalid offset '" + line.substring(0, space) + "'", lineNumber, e);
        }
        String instruction = line.substring(space + 1).strip();
        if (instruction.isEmpty()) {
            throw new StatementParseException("missing instruction after offset '" + line.substring(0, space) + "'", lineNumber, null);
        }
        return new Statement(offset, instruction);
    }
}
