package com.fortigate.config.loader;

/**
 * A structural error in the configuration text: an unmatched {@code next} or {@code end}, an
 * {@code edit} outside a table, an unterminated quoted string, an unexpected keyword or a
 * section left open at the end of the input. Parsing stops at the first error.
 */
public final class FortiConfigParseException extends LoaderException {
    private final String sourceName;
    private final int lineNumber;
    private final String lineText;

    public FortiConfigParseException(String sourceName, int lineNumber, String lineText, String message) {
        this(sourceName, lineNumber, lineText, message, null);
    }

    public FortiConfigParseException(
            String sourceName, int lineNumber, String lineText, String message, Throwable cause) {
        super(format(sourceName, lineNumber, lineText, message), cause);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.lineText = lineText;
    }

    public String getSourceName() {
        return sourceName;
    }

    /** 1-based line number of the offending line. */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLineText() {
        return lineText;
    }

    private static String format(String sourceName, int lineNumber, String lineText, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(sourceName).append(':').append(lineNumber).append(": ").append(message);
        if (lineText != null && !lineText.isEmpty()) {
            String shown = lineText.length() > 80 ? lineText.substring(0, 80) + "..." : lineText;
            sb.append(" near '").append(shown).append('\'');
        }
        return sb.toString();
    }
}
