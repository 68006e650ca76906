package com.ciro.qform.error;

import java.util.List;

/**
 * El texto no encaja con la gramática. Lleva la regla, el offset y su línea/columna (base 1).
 */
public class ParseFailureException extends QFormException {

    private final String ruleName;
    private final int offset;
    private final int line;
    private final int column;
    private final List<String> expected;

    public ParseFailureException(String ruleName, int offset, int line, int column, List<String> expected) {
        this(describe("Input does not match rule '" + ruleName + "'", offset, line, column, expected),
             ruleName, offset, line, column, expected);
    }

    protected ParseFailureException(String message, String ruleName, int offset, int line, int column,
                                    List<String> expected) {
        super(message);
        this.ruleName = ruleName;
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.expected = expected == null ? List.of() : List.copyOf(expected);
    }

    protected static String describe(String head, int offset, int line, int column, List<String> expected) {
        StringBuilder sb = new StringBuilder(head)
                .append(" at line ").append(line)
                .append(", column ").append(column)
                .append(" (offset ").append(offset).append(")");
        if (expected != null && !expected.isEmpty()) {
            sb.append("; expected one of ").append(expected);
        }
        return sb.toString();
    }

    public String getRuleName() { return ruleName; }
    public int getOffset() { return offset; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public List<String> getExpected() { return expected; }
}
