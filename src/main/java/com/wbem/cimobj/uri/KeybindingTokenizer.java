package com.wbem.cimobj.uri;

import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.uri.KeybindingToken.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the keybinding part of a WBEM URI, {@code key=value[,key=value]*}.
 *
 * <p>The token list always follows the sequence {@code NAME EQUALS value} separated by
 * {@code COMMA} and terminated by {@code EOF}; any other sequence is rejected. Quoted
 * values are returned without their quotes and with their backslash escapes intact.
 */
public class KeybindingTokenizer {

    private final String source;
    private int pos = 0;

    public KeybindingTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the entire keybinding text.
     *
     * @throws CIMValueException if the text is not a valid keybinding list
     */
    public List<KeybindingToken> tokenize() {
        List<KeybindingToken> tokens = new ArrayList<>();
        while (true) {
            tokens.add(readName());
            tokens.add(readEquals());
            tokens.add(readValue());
            if (pos >= source.length()) {
                break;
            }
            if (source.charAt(pos) != ',') {
                throw invalid("Unexpected text after keybinding value");
            }
            tokens.add(new KeybindingToken(TokenType.COMMA, ",", pos));
            pos++;
            if (pos >= source.length()) {
                throw invalid("Trailing comma in keybindings");
            }
        }
        tokens.add(new KeybindingToken(TokenType.EOF, "", pos));
        return tokens;
    }

    private KeybindingToken readName() {
        int start = pos;
        while (pos < source.length() && isNameChar(source.charAt(pos))) {
            pos++;
        }
        if (pos == start) {
            throw invalid("Missing keybinding name");
        }
        return new KeybindingToken(TokenType.NAME, source.substring(start, pos), start);
    }

    private static boolean isNameChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }

    private KeybindingToken readEquals() {
        if (pos >= source.length() || source.charAt(pos) != '=') {
            throw invalid("Missing '=' after keybinding name");
        }
        pos++;
        return new KeybindingToken(TokenType.EQUALS, "=", pos - 1);
    }

    private KeybindingToken readValue() {
        if (pos >= source.length()) {
            throw invalid("Missing keybinding value");
        }
        char c = source.charAt(pos);
        if (c == '"') {
            return readQuoted('"', TokenType.DOUBLE_QUOTED);
        }
        if (c == '\'') {
            return readQuoted('\'', TokenType.SINGLE_QUOTED);
        }
        int start = pos;
        while (pos < source.length() && source.charAt(pos) != ',') {
            pos++;
        }
        String value = source.substring(start, pos);
        if (value.isEmpty()) {
            throw invalid("Missing keybinding value");
        }
        if (value.indexOf('=') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\'') >= 0) {
            throw invalid("Invalid unquoted keybinding value '" + value + "'");
        }
        return new KeybindingToken(TokenType.UNQUOTED, value, start);
    }

    private KeybindingToken readQuoted(char quote, TokenType type) {
        int start = pos;
        pos++; // Skip opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 >= source.length()) {
                    break;
                }
                sb.append(c).append(source.charAt(pos + 1));
                pos += 2;
            } else if (c == quote) {
                pos++;
                return new KeybindingToken(type, sb.toString(), start);
            } else {
                sb.append(c);
                pos++;
            }
        }
        pos = start;
        throw invalid("Unterminated quoted keybinding value");
    }

    private CIMValueException invalid(String reason) {
        return new CIMValueException(reason + " at position " + pos + " in keybindings: '" + source + "'");
    }
}
