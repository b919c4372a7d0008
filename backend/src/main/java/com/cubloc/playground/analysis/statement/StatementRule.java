package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.Token;

/**
 * Grammar check for a statement introduced by a keyword.
 * {@code cleanLine} is the full line with comments removed; {@code keyword} indexes into it.
 */
@FunctionalInterface
public interface StatementRule {

    void validate(Token keyword, String cleanLine, int line, DiagnosticCollector diagnostics);

    static String operandsOf(Token keyword, String cleanLine) {
        if (keyword.end() >= cleanLine.length()) {
            return "";
        }
        return cleanLine.substring(keyword.end()).strip();
    }
}
