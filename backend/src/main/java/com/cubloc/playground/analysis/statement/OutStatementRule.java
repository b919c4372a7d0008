package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.analysis.Token;

/**
 * {@code OUT port, value}: port 0 to 255, value 0 or 1 when given as literals.
 */
public class OutStatementRule implements StatementRule {

    @Override
    public void validate(Token keyword, String cleanLine, int line, DiagnosticCollector diagnostics) {
        String operands = StatementRule.operandsOf(keyword, cleanLine);
        if (operands.isEmpty()) {
            diagnostics.error(line, keyword, "Out requires port, value.");
            return;
        }

        int commaIndex = LineScanner.findTopLevelComma(operands, 0);
        if (commaIndex == -1) {
            diagnostics.error(line, keyword, "Out requires port, value (missing comma).");
            return;
        }

        String port = operands.substring(0, commaIndex).strip();
        String value = operands.substring(commaIndex + 1).strip();
        if (port.isEmpty() || value.isEmpty()) {
            diagnostics.error(line, keyword, "Out requires port, value.");
            return;
        }

        if (LineScanner.isLiteralOutside(port, 0, 255)) {
            diagnostics.error(line, keyword, "Out port must be 0 to 255.");
        }
        if (LineScanner.isLiteralOutside(value, 0, 1)) {
            diagnostics.error(line, keyword, "Out value must be 0 or 1.");
        }
    }
}
