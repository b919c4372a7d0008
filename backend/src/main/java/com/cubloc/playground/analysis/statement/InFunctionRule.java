package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.analysis.Token;

import java.util.List;

/**
 * Checks every {@code IN(port)} call on a line, wherever it appears.
 * An {@code IN} not followed by {@code (} is some other use of the word and is ignored.
 */
public class InFunctionRule {

    public void validate(List<Token> tokens, String cleanLine, int line, DiagnosticCollector diagnostics) {
        for (Token token : tokens) {
            if (!token.is("IN")) {
                continue;
            }

            int openParen = LineScanner.skipWhitespace(cleanLine, token.end());
            if (openParen >= cleanLine.length() || cleanLine.charAt(openParen) != '(') {
                continue;
            }

            int closeParen = LineScanner.findMatchingParen(cleanLine, openParen);
            if (closeParen == -1) {
                diagnostics.error(line, token, "In requires a closing parenthesis.");
                continue;
            }

            String port = cleanLine.substring(openParen + 1, closeParen).strip();
            if (port.isEmpty()) {
                diagnostics.error(line, token, "In requires a port value.");
                continue;
            }

            if (LineScanner.isLiteralOutside(port, 0, 255)) {
                diagnostics.error(line, token, "In port must be 0 to 255.");
            }
        }
    }
}
