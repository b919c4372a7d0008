package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.analysis.Token;

/**
 * {@code INPUT port} and {@code OUTPUT port}.
 */
public class PortModeStatementRule implements StatementRule {

    private final String label;

    public PortModeStatementRule(String label) {
        this.label = label;
    }

    @Override
    public void validate(Token keyword, String cleanLine, int line, DiagnosticCollector diagnostics) {
        String port = StatementRule.operandsOf(keyword, cleanLine);
        if (port.isEmpty()) {
            diagnostics.error(line, keyword, label + " requires port value.");
            return;
        }

        if (LineScanner.isLiteralOutside(port, 0, 255)) {
            diagnostics.error(line, keyword, label + " port must be 0 to 255.");
        }
    }
}
