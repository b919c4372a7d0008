package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.analysis.Token;

public class DelayStatementRule implements StatementRule {

    @Override
    public void validate(Token keyword, String cleanLine, int line, DiagnosticCollector diagnostics) {
        String milliseconds = StatementRule.operandsOf(keyword, cleanLine);
        if (milliseconds.isEmpty()) {
            diagnostics.error(line, keyword, "Delay requires milliseconds value.");
            return;
        }

        // "-250" is the only literal form that can be negative
        if (milliseconds.startsWith("-")
                && LineScanner.parseIntegerLiteral(milliseconds.substring(1).strip()).isPresent()) {
            diagnostics.error(line, keyword, "Delay value must be non-negative.");
        }
    }
}
