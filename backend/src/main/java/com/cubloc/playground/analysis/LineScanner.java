package com.cubloc.playground.analysis;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * String-literal aware scanning helpers shared by the block and statement validators.
 */
public final class LineScanner {

    public record Identifier(String name, int start, int end) {
    }

    private static final int MAX_LONG_DIGITS = 18;

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private LineScanner() {
    }

    /**
     * Splits a document on {@code \n} or {@code \r\n}, keeping trailing empty lines.
     */
    public static String[] splitLines(String text) {
        return LINE_BREAK.split(text, -1);
    }

    public static boolean isIdentifierStart(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || ch == '_';
    }

    public static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || (ch >= '0' && ch <= '9');
    }

    public static int identifierEnd(String line, int start) {
        int end = start;
        while (end < line.length() && isIdentifierPart(line.charAt(end))) {
            end++;
        }
        return end;
    }

    /**
     * Cuts the line at the first {@code '} or {@code REM} word that is not inside a string literal.
     */
    public static String stripComments(String line) {
        boolean inString = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);

            if (inString) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }

            if (ch == '"') {
                inString = true;
                continue;
            }

            if (ch == '\'') {
                return line.substring(0, i);
            }

            if (isIdentifierStart(ch)) {
                int end = identifierEnd(line, i);
                if (line.substring(i, end).equalsIgnoreCase("REM")) {
                    return line.substring(0, i);
                }
                i = end - 1;
            }
        }

        return line;
    }

    /**
     * Returns the index of the first comma at or after {@code startIndex} that is neither inside
     * parentheses nor inside a string literal, or -1.
     */
    public static int findTopLevelComma(String line, int startIndex) {
        int depth = 0;
        boolean inString = false;

        for (int i = startIndex; i < line.length(); i++) {
            char ch = line.charAt(i);

            if (inString) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }

            switch (ch) {
                case '"' -> inString = true;
                case '(' -> depth++;
                case ')' -> depth = Math.max(0, depth - 1);
                case ',' -> {
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }

        return -1;
    }

    /**
     * Returns the index of the parenthesis closing the one at {@code openIndex}, or -1.
     */
    public static int findMatchingParen(String line, int openIndex) {
        int depth = 0;
        boolean inString = false;

        for (int i = openIndex + 1; i < line.length(); i++) {
            char ch = line.charAt(i);

            if (inString) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }

            if (ch == '"') {
                inString = true;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }

        return -1;
    }

    /**
     * Parses a bare decimal literal. Literals too long for a {@code long} saturate to
     * {@link Long#MAX_VALUE}, anything that is not all digits yields empty.
     */
    public static OptionalLong parseIntegerLiteral(String text) {
        if (text.isEmpty()) {
            return OptionalLong.empty();
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch < '0' || ch > '9') {
                return OptionalLong.empty();
            }
        }

        String digits = stripLeadingZeros(text);
        if (digits.length() > MAX_LONG_DIGITS) {
            return OptionalLong.of(Long.MAX_VALUE);
        }
        return OptionalLong.of(Long.parseLong(digits));
    }

    public static boolean isLiteralOutside(String text, long min, long max) {
        OptionalLong literal = parseIntegerLiteral(text);
        return literal.isPresent() && (literal.getAsLong() < min || literal.getAsLong() > max);
    }

    public static Identifier parseIdentifier(String line, int startIndex) {
        if (startIndex >= line.length() || !isIdentifierStart(line.charAt(startIndex))) {
            return null;
        }
        int end = identifierEnd(line, startIndex);
        return new Identifier(line.substring(startIndex, end), startIndex, end);
    }

    public static int skipWhitespace(String line, int index) {
        int cursor = index;
        while (cursor < line.length() && Character.isWhitespace(line.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
