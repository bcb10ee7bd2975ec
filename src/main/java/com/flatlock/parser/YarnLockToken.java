package com.flatlock.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the yarn v1 lockfile tokenizer.
 */
@Data
@AllArgsConstructor
public class YarnLockToken {
    private TokenType type;
    /** Text of the token; the nesting depth for INDENT tokens. */
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        NEWLINE,
        INDENT,
        COMMENT,
        STRING,
        NUMBER,
        BOOLEAN,
        COLON,
        COMMA,
        EOF
    }

    public boolean isValue() {
        return type == TokenType.STRING || type == TokenType.NUMBER || type == TokenType.BOOLEAN;
    }

    public int getDepth() {
        return type == TokenType.INDENT ? Integer.parseInt(value) : 0;
    }
}
