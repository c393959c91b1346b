package com.fortigate.config.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new LexerFailure(line, "column " + (charPositionInLine + 1) + ": " + msg, e);
    }

    /** Carries the line number of a recognition error out of the lexer. */
    static final class LexerFailure extends ParseCancellationException {
        private final int line;

        LexerFailure(int line, String message, Throwable cause) {
            super(message, cause);
            this.line = line;
        }

        int getLine() {
            return line;
        }
    }
}
