package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.analysis.LineScanner.Identifier;
import com.cubloc.playground.analysis.Token;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code DIM name[(dims)] AS type [* length]}, one declaration per statement.
 */
public class DimStatementRule implements StatementRule {

    private static final Set<String> ALLOWED_TYPES = Set.of("BYTE", "INTEGER", "LONG", "SINGLE", "STRING");

    private static final Pattern AS_KEYWORD = Pattern.compile("^\\s*AS\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public void validate(Token keyword, String cleanLine, int line, DiagnosticCollector diagnostics) {
        if (LineScanner.findTopLevelComma(cleanLine, keyword.end()) != -1) {
            diagnostics.error(line, keyword, "Dim does not allow multiple declarations.");
            return;
        }

        int cursor = LineScanner.skipWhitespace(cleanLine, keyword.end());
        if (cursor >= cleanLine.length()) {
            diagnostics.error(line, keyword, "Dim requires variable name.");
            return;
        }

        Identifier name = LineScanner.parseIdentifier(cleanLine, cursor);
        if (name == null) {
            diagnostics.error(line, keyword, "Dim requires variable name.");
            return;
        }

        cursor = LineScanner.skipWhitespace(cleanLine, name.end());
        if (cursor < cleanLine.length() && cleanLine.charAt(cursor) == '(') {
            int closeParen = LineScanner.findMatchingParen(cleanLine, cursor);
            if (closeParen == -1) {
                diagnostics.error(line, keyword, "Dim array requires closing parenthesis.");
                return;
            }
            cursor = closeParen + 1;
        }

        Matcher as = AS_KEYWORD.matcher(cleanLine.substring(cursor));
        if (!as.find()) {
            diagnostics.error(line, keyword, "Dim requires As <Type>.");
            return;
        }

        cursor = LineScanner.skipWhitespace(cleanLine, cursor + as.end());
        Identifier type = LineScanner.parseIdentifier(cleanLine, cursor);
        if (type == null) {
            diagnostics.error(line, keyword, "Dim As requires Type.");
            return;
        }

        String typeName = type.name().toUpperCase(Locale.ROOT);
        if (!ALLOWED_TYPES.contains(typeName)) {
            diagnostics.error(line, keyword, "Invalid Dim Type.");
            return;
        }

        cursor = LineScanner.skipWhitespace(cleanLine, type.end());
        if (cursor < cleanLine.length() && cleanLine.charAt(cursor) == '*') {
            validateStringLength(keyword, typeName, cleanLine, cursor, line, diagnostics);
        }
    }

    private void validateStringLength(Token keyword, String typeName, String cleanLine, int star, int line,
            DiagnosticCollector diagnostics) {
        if (!typeName.equals("STRING")) {
            diagnostics.error(line, keyword, "Only String may use * length.");
            return;
        }

        int start = LineScanner.skipWhitespace(cleanLine, star + 1);
        int end = LineScanner.identifierEnd(cleanLine, start);
        if (end == start) {
            diagnostics.error(line, keyword, "String length required after *.");
            return;
        }

        if (LineScanner.parseIntegerLiteral(cleanLine.substring(start, end)).isEmpty()) {
            diagnostics.error(line, keyword, "String length must be a number.");
        }
    }
}
