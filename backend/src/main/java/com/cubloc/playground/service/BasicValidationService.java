package com.cubloc.playground.service;

import com.cubloc.playground.analysis.BasicTokenizer;
import com.cubloc.playground.analysis.BlockNestingValidator;
import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.analysis.Token;
import com.cubloc.playground.analysis.statement.StatementRules;
import com.cubloc.playground.config.CublocLintProperties;
import com.cubloc.playground.dto.Diagnostic;
import com.cubloc.playground.dto.DiagnosticsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one full validation pass over a document: line hygiene, block nesting and statement grammar.
 * A pass keeps no state between calls.
 */
@Service
public class BasicValidationService {

    private static final Logger logger = LoggerFactory.getLogger(BasicValidationService.class);

    private final CublocLintProperties properties;
    private final StatementRules statementRules = StatementRules.standard();

    public BasicValidationService(CublocLintProperties properties) {
        this.properties = properties;
    }

    public DiagnosticsResponse analyze(String sourceCode) {
        long startTime = System.currentTimeMillis();

        if (sourceCode == null) {
            return DiagnosticsResponse.error("Source code cannot be null", 0);
        }

        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            logger.warn("Rejected source of {} characters (limit {})",
                    sourceCode.length(), properties.maxSourceCodeLength());
            return DiagnosticsResponse.error(
                    "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters",
                    0);
        }

        try {
            List<Diagnostic> diagnostics = validate(sourceCode);
            long analysisTime = System.currentTimeMillis() - startTime;

            logger.debug("Validated {} characters in {}ms: {} diagnostics",
                    sourceCode.length(), analysisTime, diagnostics.size());

            return DiagnosticsResponse.success(diagnostics, analysisTime);

        } catch (RuntimeException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Validation failed", e);
            return DiagnosticsResponse.error("Validation failed: " + e.getMessage(), analysisTime);
        }
    }

    public List<Diagnostic> validate(String text) {
        DiagnosticCollector diagnostics = new DiagnosticCollector(properties.diagnosticSource());
        BlockNestingValidator blocks = new BlockNestingValidator(diagnostics);
        String[] lines = LineScanner.splitLines(text);

        for (int lineNumber = 0; lineNumber < lines.length; lineNumber++) {
            String line = lines[lineNumber];
            List<Token> tokens = BasicTokenizer.tokenize(line);

            checkHygiene(line, lineNumber, diagnostics);

            if (!tokens.isEmpty()) {
                blocks.validateLine(tokens, lineNumber);
                statementRules.validateLine(tokens, LineScanner.stripComments(line), lineNumber, diagnostics);
            }
        }

        blocks.finish();
        return diagnostics.diagnostics();
    }

    private void checkHygiene(String line, int lineNumber, DiagnosticCollector diagnostics) {
        int maxLineLength = properties.maxLineLength();
        if (line.length() > maxLineLength) {
            diagnostics.warning(lineNumber, maxLineLength, line.length(),
                    "Line exceeds " + maxLineLength + " characters.");
        }

        int tabIndex = line.indexOf('\t');
        if (tabIndex != -1) {
            diagnostics.information(lineNumber, tabIndex, tabIndex + 1, "Tab character found; prefer spaces.");
        }
    }
}
