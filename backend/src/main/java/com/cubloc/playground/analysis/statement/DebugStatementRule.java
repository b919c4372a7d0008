package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.Token;

public class DebugStatementRule implements StatementRule {

    @Override
    public void validate(Token keyword, String cleanLine, int line, DiagnosticCollector diagnostics) {
        if (StatementRule.operandsOf(keyword, cleanLine).isEmpty()) {
            diagnostics.error(line, keyword, "Debug requires data.");
        }
    }
}
