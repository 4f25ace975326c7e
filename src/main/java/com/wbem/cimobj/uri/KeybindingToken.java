package com.wbem.cimobj.uri;

import lombok.Value;

/**
 * Represents a token of the keybinding part of a WBEM URI.
 */
@Value
public class KeybindingToken {
    TokenType type;
    String value;
    int position;

    public enum TokenType {
        NAME,
        EQUALS,
        DOUBLE_QUOTED,
        SINGLE_QUOTED,
        UNQUOTED,
        COMMA,
        EOF
    }

    public boolean isValue() {
        return type == TokenType.DOUBLE_QUOTED || type == TokenType.SINGLE_QUOTED
            || type == TokenType.UNQUOTED;
    }
}
