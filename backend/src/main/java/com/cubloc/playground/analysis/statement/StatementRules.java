package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.Token;

import java.util.List;
import java.util.Map;

/**
 * Dispatches a line to the rule registered for its first keyword, then checks its {@code IN(...)} calls.
 */
public final class StatementRules {

    private final Map<String, StatementRule> rules;
    private final InFunctionRule inFunctionRule = new InFunctionRule();

    public StatementRules(Map<String, StatementRule> rules) {
        this.rules = Map.copyOf(rules);
    }

    public static StatementRules standard() {
        return new StatementRules(Map.of(
                "OUT", new OutStatementRule(),
                "INPUT", new PortModeStatementRule("Input"),
                "OUTPUT", new PortModeStatementRule("Output"),
                "DEBUG", new DebugStatementRule(),
                "DELAY", new DelayStatementRule(),
                "DIM", new DimStatementRule()));
    }

    public void validateLine(List<Token> tokens, String cleanLine, int line, DiagnosticCollector diagnostics) {
        if (tokens.isEmpty()) {
            return;
        }

        Token keyword = tokens.get(0);
        StatementRule rule = rules.get(keyword.text());
        if (rule != null) {
            rule.validate(keyword, cleanLine, line, diagnostics);
        }

        inFunctionRule.validate(tokens, cleanLine, line, diagnostics);
    }
}
