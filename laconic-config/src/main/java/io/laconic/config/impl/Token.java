/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import io.laconic.config.ConfigOrigin;

final class Token {
    final private TokenType tokenType;
    final private String text;
    final private ConfigOrigin start;

    Token(TokenType tokenType, String text, ConfigOrigin start) {
        this.tokenType = tokenType;
        this.text = text;
        this.start = start;
    }

    // START and END carry no text
    static Token newMarker(TokenType tokenType, ConfigOrigin at) {
        return new Token(tokenType, "", at);
    }

    TokenType tokenType() {
        return tokenType;
    }

    /**
     * @return the token text; for strings the decoded content without quotes
     */
    String text() {
        return text;
    }

    ConfigOrigin start() {
        return start;
    }

    int lineNumber() {
        return start.lineNumber();
    }

    @Override
    public String toString() {
        switch (tokenType) {
        case START:
            return "start of input";
        case END:
            return "end of input";
        case STRING:
            return "'" + text + "' (STRING)";
        case NULL:
            return "'null'";
        default:
            return "'" + text + "'";
        }
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof Token) {
            // positions are deliberately left out
            Token o = (Token) other;
            return this.tokenType == o.tokenType && this.text.equals(o.text);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        // positions are deliberately left out
        return 41 * (41 + tokenType.hashCode()) + text.hashCode();
    }
}
