package com.wbem.cimobj.mof;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * MOF string literal escaping and line wrapping.
 *
 * <p>Both {@link #mofstr} and {@link #mofval} continue a line that already holds
 * {@code linePos} characters and report the line position after the emitted text, so
 * that callers can chain several values on one line.
 */
public class MofStrings {

    private MofStrings() {
        // Utility class
    }

    /**
     * Emitted MOF text and the position on the last line after it.
     */
    @Value
    public static class MofText {
        String text;
        int linePos;
    }

    /**
     * Escape every character of a string for use in a MOF string or char16 literal.
     */
    public static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (String token : escapeTokens(value)) {
            sb.append(token);
        }
        return sb.toString();
    }

    private static List<String> escapeTokens(String value) {
        List<String> tokens = new ArrayList<>(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\b' -> tokens.add("\\b");
                case '\t' -> tokens.add("\\t");
                case '\n' -> tokens.add("\\n");
                case '\f' -> tokens.add("\\f");
                case '\r' -> tokens.add("\\r");
                case '\\' -> tokens.add("\\\\");
                case '\'' -> tokens.add("\\'");
                case '"' -> tokens.add("\\\"");
                default -> tokens.add(c < 0x20 ? String.format("\\x%04X", (int) c) : String.valueOf(c));
            }
        }
        return tokens;
    }

    /**
     * A string literal, split into several quoted fragments on continuation lines when it
     * does not fit into the line.
     *
     * <p>A fragment ends after the last blank that fits into the line; a word longer than
     * the line is cut at the line end. Escape sequences are never cut.
     *
     * @param indent      indentation of continuation lines
     * @param maxline     maximum line length
     * @param linePos     characters already on the current line
     * @param endSpace    characters that will follow the literal on its last line
     * @param avoidSplits start a new line first if the literal does not fit on the current line
     * @param quote       {@code "} for strings, {@code '} for char16 values
     */
    public static MofText mofstr(String value, int indent, int maxline, int linePos, int endSpace,
                                 boolean avoidSplits, char quote) {
        List<String> tokens = escapeTokens(value);
        int total = 0;
        for (String token : tokens) {
            total += token.length();
        }
        StringBuilder out = new StringBuilder();
        if (avoidSplits && linePos > indent && total + 2 + endSpace > maxline - linePos) {
            out.append('\n').append(" ".repeat(indent));
            linePos = indent;
        }
        int start = 0;
        int remaining = total;
        while (true) {
            int available = maxline - linePos - 2;
            if (start >= tokens.size() || remaining <= available - endSpace) {
                appendFragment(out, tokens, start, tokens.size(), quote);
                linePos += remaining + 2;
                break;
            }
            int cut = cutIndex(tokens, start, available);
            int length = 0;
            for (int i = start; i < cut; i++) {
                length += tokens.get(i).length();
            }
            appendFragment(out, tokens, start, cut, quote);
            if (cut == tokens.size()) {
                linePos += length + 2;
                break;
            }
            out.append('\n').append(" ".repeat(indent));
            linePos = indent;
            remaining -= length;
            start = cut;
        }
        return new MofText(out.toString(), linePos);
    }

    /**
     * String literal with the default quote character {@code "}.
     */
    public static MofText mofstr(String value, int indent, int maxline, int linePos, int endSpace,
                                 boolean avoidSplits) {
        return mofstr(value, indent, maxline, linePos, endSpace, avoidSplits, '"');
    }

    // End index of the next fragment: after the last blank within the available width,
    // otherwise as many tokens as fit. At least one token, and never all remaining tokens.
    private static int cutIndex(List<String> tokens, int start, int available) {
        int length = 0;
        int fit = start;
        int afterBlank = -1;
        while (fit < tokens.size() && length + tokens.get(fit).length() <= available) {
            length += tokens.get(fit).length();
            fit++;
            if (" ".equals(tokens.get(fit - 1))) {
                afterBlank = fit;
            }
        }
        if (fit == tokens.size() && fit - start > 1) {
            fit--;
            if (afterBlank == tokens.size()) {
                afterBlank = -1;
            }
        }
        int cut = afterBlank > start ? afterBlank : fit;
        return Math.max(cut, start + 1);
    }

    private static void appendFragment(StringBuilder out, List<String> tokens, int from, int to, char quote) {
        out.append(quote);
        for (int i = from; i < to; i++) {
            out.append(tokens.get(i));
        }
        out.append(quote);
    }

    /**
     * An unsplittable value such as a number, a boolean or {@code NULL}. It moves to a new
     * line when it does not fit on the current one.
     */
    public static MofText mofval(String value, int indent, int maxline, int linePos, int endSpace) {
        if (value.length() <= maxline - linePos - endSpace) {
            return new MofText(value, linePos + value.length());
        }
        return new MofText("\n" + " ".repeat(indent) + value, indent + value.length());
    }
}
