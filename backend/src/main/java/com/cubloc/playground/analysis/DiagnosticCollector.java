package com.cubloc.playground.analysis;

import com.cubloc.playground.dto.Diagnostic;
import com.cubloc.playground.dto.Diagnostic.Severity;

import java.util.ArrayList;
import java.util.List;

public final class DiagnosticCollector {

    private final String source;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public DiagnosticCollector(String source) {
        this.source = source;
    }

    public void error(int line, int start, int end, String message) {
        add(Severity.ERROR, line, start, end, message);
    }

    public void error(int line, Token token, String message) {
        add(Severity.ERROR, line, token.index(), token.end(), message);
    }

    public void error(BlockFrame frame, String message) {
        add(Severity.ERROR, frame.line(), frame.column(), frame.endColumn(), message);
    }

    public void warning(int line, int start, int end, String message) {
        add(Severity.WARNING, line, start, end, message);
    }

    public void information(int line, int start, int end, String message) {
        add(Severity.INFORMATION, line, start, end, message);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    private void add(Severity severity, int line, int start, int end, String message) {
        diagnostics.add(new Diagnostic(line, start, line, end, severity, message, source));
    }
}
