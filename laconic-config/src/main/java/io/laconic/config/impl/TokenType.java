/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

enum TokenType {
    START,
    END,
    IDENTIFIER,
    STRING,
    NULL,
    OPEN_CURLY,
    CLOSE_CURLY,
    EQUALS;
}
