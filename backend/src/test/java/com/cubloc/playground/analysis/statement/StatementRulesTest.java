package com.cubloc.playground.analysis.statement;

import com.cubloc.playground.analysis.BasicTokenizer;
import com.cubloc.playground.analysis.DiagnosticCollector;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.dto.Diagnostic;
import com.cubloc.playground.dto.Diagnostic.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementRulesTest {

    private final StatementRules rules = StatementRules.standard();

    private List<Diagnostic> check(String line) {
        DiagnosticCollector diagnostics = new DiagnosticCollector("cubloc-basic");
        rules.validateLine(BasicTokenizer.tokenize(line), LineScanner.stripComments(line), 0, diagnostics);
        return diagnostics.diagnostics();
    }

    private static Diagnostic error(int start, int end, String message) {
        return new Diagnostic(0, start, 0, end, Severity.ERROR, message, "cubloc-basic");
    }

    // ========== Out ==========

    @Test
    void testOutPortOutOfRange() {
        assertEquals(List.of(error(0, 3, "Out port must be 0 to 255.")), check("OUT 300, 1"));
    }

    @Test
    void testOutValueMustBeBinary() {
        assertEquals(List.of(error(0, 3, "Out value must be 0 or 1.")), check("OUT 5, 2"));
        assertEquals(List.of(
                error(2, 5, "Out port must be 0 to 255."),
                error(2, 5, "Out value must be 0 or 1.")), check("  Out 256, 7"));
    }

    @Test
    void testOutValid() {
        assertEquals(List.of(), check("OUT 5, 1"));
        assertEquals(List.of(), check("OUT port, level"));
        assertEquals(List.of(), check("OUT Max(1, 2), 1 ' pick"));
        assertEquals(List.of(), check("OUT base + 300, x * 2"));
    }

    @Test
    void testOutShape() {
        assertEquals(List.of(error(0, 3, "Out requires port, value.")), check("OUT"));
        assertEquals(List.of(error(0, 3, "Out requires port, value.")), check("OUT ' nothing"));
        assertEquals(List.of(error(0, 3, "Out requires port, value (missing comma).")), check("OUT 5"));
        assertEquals(List.of(error(0, 3, "Out requires port, value (missing comma).")), check("OUT Max(1, 2)"));
        assertEquals(List.of(error(0, 3, "Out requires port, value.")), check("OUT 5,"));
        assertEquals(List.of(error(0, 3, "Out requires port, value.")), check("OUT , 1"));
    }

    // ========== Input / Output ==========

    @Test
    void testInputAndOutputPorts() {
        assertEquals(List.of(error(0, 5, "Input port must be 0 to 255.")), check("INPUT 256"));
        assertEquals(List.of(error(0, 5, "Input requires port value.")), check("INPUT"));
        assertEquals(List.of(error(0, 6, "Output requires port value.")), check("OUTPUT   "));
        assertEquals(List.of(error(0, 6, "Output port must be 0 to 255.")), check("output 1000"));
        assertEquals(List.of(), check("OUTPUT 8"));
        assertEquals(List.of(), check("INPUT pin"));
    }

    // ========== Debug / Delay ==========

    @Test
    void testDebugRequiresData() {
        assertEquals(List.of(error(0, 5, "Debug requires data.")), check("DEBUG"));
        assertEquals(List.of(error(0, 5, "Debug requires data.")), check("DEBUG ' later"));
        assertEquals(List.of(), check("DEBUG \"it's ok\", CR"));
    }

    @Test
    void testDelay() {
        assertEquals(List.of(error(0, 5, "Delay requires milliseconds value.")), check("DELAY"));
        assertEquals(List.of(error(0, 5, "Delay value must be non-negative.")), check("DELAY -5"));
        assertEquals(List.of(), check("DELAY 100"));
        assertEquals(List.of(), check("DELAY wait - 5"));
    }

    // ========== In(port) ==========

    @Test
    void testInAnywhereOnLine() {
        assertEquals(List.of(error(4, 6, "In port must be 0 to 255.")), check("x = IN(300)"));
        assertEquals(List.of(error(4, 6, "In requires a closing parenthesis.")), check("x = IN(3"));
        assertEquals(List.of(error(4, 6, "In requires a port value.")), check("x = In( )"));
        assertEquals(List.of(error(3, 5, "In port must be 0 to 255.")), check("IF IN(999) = 1 THEN"));
        assertEquals(List.of(), check("x = IN(port(2)) + IN (7)"));
    }

    @Test
    void testEveryInOccurrenceIsChecked() {
        assertEquals(List.of(
                error(4, 6, "In port must be 0 to 255."),
                error(16, 18, "In requires a port value.")), check("x = IN(256) And IN()"));
    }

    @Test
    void testInWithoutParenthesisIsIgnored() {
        assertEquals(List.of(), check("FOR EACH item IN list"));
        assertEquals(List.of(), check("PRINT \"IN(999)\""));
    }

    // ========== Dim ==========

    @Test
    void testDimValid() {
        assertEquals(List.of(), check("DIM x AS INTEGER"));
        assertEquals(List.of(), check("Dim buf(10, 2) As Byte"));
        assertEquals(List.of(), check("DIM name AS STRING * 20"));
        assertEquals(List.of(), check("DIM x AS BYTE ' a, b"));
    }

    @Test
    void testDimMultipleDeclarations() {
        assertEquals(List.of(error(0, 3, "Dim does not allow multiple declarations.")), check("DIM x, y AS INTEGER"));
    }

    @Test
    void testDimName() {
        assertEquals(List.of(error(0, 3, "Dim requires variable name.")), check("DIM"));
        assertEquals(List.of(error(0, 3, "Dim requires variable name.")), check("DIM 1x AS BYTE"));
        assertEquals(List.of(error(0, 3, "Dim array requires closing parenthesis.")), check("DIM a(10 AS BYTE"));
    }

    @Test
    void testDimType() {
        assertEquals(List.of(error(0, 3, "Dim requires As <Type>.")), check("DIM x INTEGER"));
        assertEquals(List.of(error(0, 3, "Dim As requires Type.")), check("DIM x AS"));
        assertEquals(List.of(error(0, 3, "Invalid Dim Type.")), check("DIM x AS FLOAT"));
    }

    @Test
    void testDimStringLength() {
        assertEquals(List.of(error(0, 3, "Only String may use * length.")), check("DIM n AS INTEGER * 2"));
        assertEquals(List.of(error(0, 3, "String length must be a number.")), check("DIM s AS STRING * abc"));
        assertEquals(List.of(error(0, 3, "String length required after *.")), check("DIM s AS STRING *"));
    }

    @Test
    void testDimDiagnosticsAnchorAtIndentedKeyword() {
        assertEquals(List.of(error(4, 7, "Invalid Dim Type.")), check("    Dim x As Float"));
        assertEquals(List.of(error(2, 5, "String length must be a number.")), check("  DIM s AS STRING * n"));
    }

    @Test
    void testUnknownStatementsPassUnchecked() {
        assertEquals(List.of(), check("PRINT"));
        assertEquals(List.of(), check("x = 1"));
    }
}
