package com.fortigate.config.loader;

import com.fortigate.config.loader.grammar.FortiConfigLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Splits configuration text into classified {@link ConfigLine}s using the generated
 * {@link FortiConfigLexer}. Arguments are whitespace separated; double-quoted strings are kept
 * verbatim with their quotes and escapes and may contain line breaks.
 */
public final class FortiConfigTokenizer {

    public List<ConfigLine> tokenize(String sourceName, String input) throws FortiConfigParseException {
        return tokenize(sourceName, CharStreams.fromString(input, sourceName));
    }

    public List<ConfigLine> tokenize(String sourceName, CharStream input) throws FortiConfigParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        FortiConfigLexer lexer = new FortiConfigLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            tokens.fill();
        } catch (ThrowingErrorListener.LexerFailure ex) {
            throw new FortiConfigParseException(sourceName, ex.getLine(), "", ex.getMessage(), ex);
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(tokens, lexer);
        }

        List<ConfigLine> lines = new ArrayList<>();
        List<Token> pending = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            int type = token.getType();
            if (type != FortiConfigLexer.NEWLINE && type != Token.EOF) {
                pending.add(token);
                continue;
            }
            if (!pending.isEmpty()) {
                lines.add(toLine(sourceName, input, pending));
                pending.clear();
            } else if (type == FortiConfigLexer.NEWLINE) {
                lines.add(new ConfigLine(LineKind.BLANK, "", List.of(), token.getLine(), ""));
            }
        }
        return lines;
    }

    private static ConfigLine toLine(String sourceName, CharStream input, List<Token> tokens)
            throws FortiConfigParseException {
        Token first = tokens.get(0);
        Token last = tokens.get(tokens.size() - 1);
        String text = input.getText(Interval.of(first.getStartIndex(), last.getStopIndex()));
        int lineNumber = first.getLine();

        List<String> arguments = new ArrayList<>(tokens.size() - 1);
        for (Token token : tokens.subList(1, tokens.size())) {
            switch (token.getType()) {
                case FortiConfigLexer.STRING:
                case FortiConfigLexer.WORD:
                    arguments.add(token.getText());
                    break;
                case FortiConfigLexer.UNTERMINATED_STRING:
                    throw new FortiConfigParseException(
                            sourceName, lineNumber, text, "unterminated quoted string starting at line " + token.getLine());
                default:
                    throw new FortiConfigParseException(
                            sourceName, lineNumber, text, "unexpected token '" + token.getText() + "'");
            }
        }
        return new ConfigLine(kindOf(first), first.getText(), arguments, lineNumber, text);
    }

    private static LineKind kindOf(Token keyword) {
        switch (keyword.getType()) {
            case FortiConfigLexer.CONFIG_KEY:
                return LineKind.CONFIG;
            case FortiConfigLexer.EDIT_KEY:
                return LineKind.EDIT;
            case FortiConfigLexer.SET_KEY:
                return LineKind.SET;
            case FortiConfigLexer.UNSET_KEY:
                return LineKind.UNSET;
            case FortiConfigLexer.NEXT_KEY:
                return LineKind.NEXT;
            case FortiConfigLexer.END_KEY:
                return LineKind.END;
            case FortiConfigLexer.COMMENT:
                return LineKind.COMMENT;
            default:
                return LineKind.UNKNOWN;
        }
    }
}
