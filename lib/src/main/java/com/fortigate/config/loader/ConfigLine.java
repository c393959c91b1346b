package com.fortigate.config.loader;

import java.util.List;
import java.util.Objects;

/**
 * One logical line of a configuration: the leading keyword and the argument tokens that follow
 * it. A quoted argument may span several physical lines; {@link #getLineNumber()} is the line
 * the keyword is on.
 */
public final class ConfigLine {
    private final LineKind kind;
    private final String keyword;
    private final List<String> arguments;
    private final int lineNumber;
    private final String text;

    public ConfigLine(LineKind kind, String keyword, List<String> arguments, int lineNumber, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.arguments = List.copyOf(arguments);
        this.lineNumber = lineNumber;
        this.text = Objects.requireNonNull(text, "text");
    }

    public LineKind getKind() {
        return kind;
    }

    public String getKeyword() {
        return keyword;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /** Source text of the line without its line terminator. */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return lineNumber + ":" + kind + arguments;
    }
}
