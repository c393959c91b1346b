package com.fortigate.config.loader;

import com.fortigate.config.loader.grammar.FortiConfigLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "fgtconfig.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "FGTCONFIG_DEBUG_TOKENS";
    // Null unless a capture was started on the current thread.
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS = new ThreadLocal<>();

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    public static void logTokens(CommonTokenStream tokens, FortiConfigLexer lexer) {
        List<String> capture = CAPTURED_TOKENS.get();
        if (capture == null && !LOGGER.isLoggable(Level.FINE)) {
            return;
        }
        StringBuilder dump = new StringBuilder("Token dump for debugging:");
        for (Token token : tokens.getTokens()) {
            String symbolic = token.getType() == Token.EOF ? "EOF" : lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-20s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText().replace("\n", "\\n"));
            dump.append(System.lineSeparator()).append("  ").append(line);
            if (capture != null) {
                capture.add(line);
            }
        }
        LOGGER.fine(dump::toString);
    }

    /** Starts keeping dumped token lines on the current thread until they are drained. */
    public static void startCapture() {
        CAPTURED_TOKENS.set(new ArrayList<>());
    }

    /** Returns the lines captured since {@link #startCapture()} and stops capturing. */
    public static List<String> drainCapturedTokens() {
        List<String> captured = CAPTURED_TOKENS.get();
        CAPTURED_TOKENS.remove();
        return captured == null ? List.of() : captured;
    }
}
