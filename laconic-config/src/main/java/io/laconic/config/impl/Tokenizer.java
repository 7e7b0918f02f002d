/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigOrigin;

final class Tokenizer {
    // this exception should not leave this file
    private static class ProblemException extends Exception {
        private static final long serialVersionUID = 1L;

        final private transient ConfigOrigin origin;

        ProblemException(ConfigOrigin origin, String message) {
            super(message);
            this.origin = origin;
        }

        ConfigException.Lex toConfigException() {
            return new ConfigException.Lex(origin, getMessage());
        }
    }

    private static String asString(int codepoint) {
        if (codepoint == '\n')
            return "newline";
        else if (codepoint == '\r')
            return "carriage return";
        else if (codepoint == '\t')
            return "tab";
        else if (codepoint == -1)
            return "end of file";
        else if (Character.isISOControl(codepoint))
            return String.format("control character 0x%x", codepoint);
        else
            return String.format("%c", codepoint);
    }

    /**
     * Tokenizes the whole input. The list starts with a START token and ends
     * with an END token. Lexing always completes before anything is handed to
     * the parser, so a lexical problem surfaces before any tree is built.
     */
    static List<Token> tokenize(ConfigOrigin origin, String input) {
        List<Token> tokens = new ArrayList<Token>();
        Iterator<Token> i = new TokenIterator((SimpleConfigOrigin) origin, input);
        while (i.hasNext()) {
            tokens.add(i.next());
        }
        return tokens;
    }

    private static class TokenIterator implements Iterator<Token> {

        final private SimpleConfigOrigin origin;
        final private String input;
        final private int length;
        private int index;
        private int lineNumber;
        private int columnNumber;
        // true until something other than blanks is seen on the current line
        private boolean freshLine;
        private boolean startEmitted;
        private boolean endEmitted;

        TokenIterator(SimpleConfigOrigin origin, String input) {
            this.origin = origin;
            this.input = input != null ? input : "";
            this.length = this.input.length();
            this.index = 0;
            this.lineNumber = 1;
            this.columnNumber = 1;
            this.freshLine = true;
            this.startEmitted = false;
            this.endEmitted = false;
        }

        private ConfigOrigin position() {
            return origin.setPosition(lineNumber, columnNumber, index);
        }

        private int peek(int offset) {
            int at = index + offset;
            if (at >= length)
                return -1;
            return input.charAt(at);
        }

        private int peek() {
            return peek(0);
        }

        private void advance() {
            if (index >= length)
                return;
            char c = input.charAt(index);
            index += 1;
            if (c == '\r') {
                if (index < length && input.charAt(index) == '\n')
                    index += 1;
                newLine();
            } else if (c == '\n') {
                newLine();
            } else {
                columnNumber += 1;
                if (c != ' ' && c != '\t')
                    freshLine = false;
            }
        }

        private void advance(int count) {
            for (int i = 0; i < count; ++i)
                advance();
        }

        private void newLine() {
            lineNumber += 1;
            columnNumber = 1;
            freshLine = true;
        }

        static boolean isNewline(int c) {
            return c == '\n' || c == '\r';
        }

        static boolean isBlank(int c) {
            return c == ' ' || c == '\t';
        }

        static boolean isQuote(int c) {
            return c == '"' || c == '\'';
        }

        private boolean startOfLineComment(int c) {
            if (c == '#') {
                return freshLine;
            } else if (c == '/') {
                return peek(1) == '/';
            } else {
                return false;
            }
        }

        private boolean startOfBlockComment(int c) {
            return (c == '/' || c == '|') && peek(1) == '*';
        }

        private void skipLineComment() {
            while (index < length && !isNewline(peek())) {
                advance();
            }
        }

        // the opening "/*" or "|*" has not been consumed yet
        private void skipBlockComment(int opener) throws ProblemException {
            ConfigOrigin start = position();
            int closer = opener == '/' ? '/' : '|';
            advance(2);
            while (index < length) {
                if (peek() == '*' && peek(1) == closer) {
                    advance(2);
                    return;
                }
                advance();
            }
            throw new ProblemException(start, "Unterminated comment block, expecting '*"
                    + (char) closer + "' before end of file");
        }

        // the "$" and the quote have not been consumed yet
        private Token pullVerbatimString() throws ProblemException {
            ConfigOrigin start = position();
            int quote = peek(1);
            advance(2);
            StringBuilder sb = new StringBuilder();
            while (index < length) {
                int c = peek();
                if (c == quote) {
                    if (peek(1) == quote) {
                        // a doubled quote stands for one literal quote
                        sb.appendCodePoint(c);
                        advance(2);
                        continue;
                    }
                    advance();
                    return new Token(TokenType.STRING, sb.toString(), start);
                }
                if (c == '\r' && peek(1) == '\n') {
                    sb.append("\r\n");
                } else {
                    sb.append((char) c);
                }
                advance();
            }
            throw new ProblemException(start, "Unterminated verbatim string, expecting "
                    + asString(quote) + " before end of file");
        }

        // ASCII hex digits only
        private static int hexValue(int c) {
            if (c >= '0' && c <= '9')
                return c - '0';
            else if (c >= 'a' && c <= 'f')
                return c - 'a' + 10;
            else if (c >= 'A' && c <= 'F')
                return c - 'A' + 10;
            else
                return -1;
        }

        private void pullEscapeSequence(StringBuilder sb, ConfigOrigin stringStart)
                throws ProblemException {
            ConfigOrigin at = position();
            // the backslash
            advance();
            int escaped = peek();
            if (escaped == -1)
                throw new ProblemException(stringStart,
                        "End of input but backslash in string had nothing after it");

            switch (escaped) {
            case '"':
                sb.append('"');
                break;
            case '\'':
                sb.append('\'');
                break;
            case '\\':
                sb.append('\\');
                break;
            case '0':
                sb.append('\0');
                break;
            case 'a':
                sb.append('\u0007');
                break;
            case 'b':
                sb.append('\b');
                break;
            case 'f':
                sb.append('\f');
                break;
            case 'n':
                sb.append('\n');
                break;
            case 'r':
                sb.append('\r');
                break;
            case 't':
                sb.append('\t');
                break;
            case 'v':
                sb.append('\u000B');
                break;
            case 'u': {
                advance();
                int code = 0;
                for (int i = 0; i < 4; ++i) {
                    int d = hexValue(peek(i));
                    if (d < 0)
                        throw new ProblemException(at,
                                "Invalid unicode escape, \\u must be followed by exactly 4 hex digits");
                    code = code * 16 + d;
                }
                advance(4);
                sb.appendCodePoint(code);
                return;
            }
            case 'x': {
                advance();
                int code = 0;
                int digits = 0;
                while (digits < 4 && hexValue(peek()) >= 0) {
                    code = code * 16 + hexValue(peek());
                    digits += 1;
                    advance();
                }
                if (digits == 0)
                    throw new ProblemException(at,
                            "Invalid hex escape, \\x must be followed by 1 to 4 hex digits");
                sb.appendCodePoint(code);
                return;
            }
            default:
                throw new ProblemException(at, String.format(
                        "backslash followed by '%s', this is not a valid escape sequence (use double-backslash \\\\ for literal backslash)",
                        asString(escaped)));
            }
            advance();
        }

        // the opening quote has not been consumed yet
        private Token pullQuotedString() throws ProblemException {
            ConfigOrigin start = position();
            int quote = peek();
            advance();
            StringBuilder sb = new StringBuilder();
            while (index < length) {
                int c = peek();
                if (isNewline(c)) {
                    throw new ProblemException(start,
                            "Unterminated string, line break before closing " + asString(quote));
                } else if (c == quote) {
                    advance();
                    return new Token(TokenType.STRING, sb.toString(), start);
                } else if (c == '\\') {
                    pullEscapeSequence(sb, start);
                } else {
                    sb.append((char) c);
                    advance();
                }
            }
            throw new ProblemException(start, "Unterminated string, expecting " + asString(quote)
                    + " before end of file");
        }

        private boolean endsIdentifier(int c) {
            if (c == -1 || isBlank(c) || isNewline(c))
                return true;
            if (c == '{' || c == '}' || c == '=' || isQuote(c))
                return true;
            int next = peek(1);
            if (c == '/' && (next == '/' || next == '*'))
                return true;
            if (c == '|' && next == '*')
                return true;
            if (c == '$' && isQuote(next))
                return true;
            return false;
        }

        private Token pullIdentifier() throws ProblemException {
            ConfigOrigin start = position();
            StringBuilder sb = new StringBuilder();
            while (index < length && !endsIdentifier(peek())) {
                sb.append((char) peek());
                advance();
            }
            if (sb.length() == 0)
                throw new ProblemException(start, "Unexpected character '" + asString(peek()) + "'");

            String s = sb.toString();
            if (s.equals("null"))
                return new Token(TokenType.NULL, s, start);
            else
                return new Token(TokenType.IDENTIFIER, s, start);
        }

        private Token pullNextToken() throws ProblemException {
            while (index < length) {
                int c = peek();
                if (isBlank(c) || isNewline(c)) {
                    advance();
                } else if (startOfLineComment(c)) {
                    skipLineComment();
                } else if (startOfBlockComment(c)) {
                    skipBlockComment(c);
                } else if (c == '$' && isQuote(peek(1))) {
                    return pullVerbatimString();
                } else if (isQuote(c)) {
                    return pullQuotedString();
                } else if (c == '{' || c == '}' || c == '=') {
                    ConfigOrigin start = position();
                    advance();
                    TokenType t = c == '{' ? TokenType.OPEN_CURLY
                            : (c == '}' ? TokenType.CLOSE_CURLY : TokenType.EQUALS);
                    return new Token(t, String.valueOf((char) c), start);
                } else {
                    return pullIdentifier();
                }
            }
            return Token.newMarker(TokenType.END, position());
        }

        @Override
        public boolean hasNext() {
            return !endEmitted;
        }

        @Override
        public Token next() {
            if (endEmitted)
                throw new NoSuchElementException("token stream is exhausted");
            if (!startEmitted) {
                startEmitted = true;
                return Token.newMarker(TokenType.START, position());
            }
            Token t;
            try {
                t = pullNextToken();
            } catch (ProblemException e) {
                throw e.toConfigException();
            }
            if (t.tokenType() == TokenType.END)
                endEmitted = true;
            return t;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException(
                    "Does not make sense to remove items from token stream");
        }
    }
}
