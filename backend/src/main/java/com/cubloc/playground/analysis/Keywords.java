package com.cubloc.playground.analysis;

import java.util.Map;

/**
 * Display labels for upper-cased keywords, used when keywords are quoted in messages.
 */
public final class Keywords {

    private static final Map<String, String> LABELS = Map.ofEntries(
            Map.entry("IF", "If"),
            Map.entry("THEN", "Then"),
            Map.entry("ELSE", "Else"),
            Map.entry("ELSEIF", "ElseIf"),
            Map.entry("ENDIF", "End If"),
            Map.entry("FOR", "For"),
            Map.entry("TO", "To"),
            Map.entry("STEP", "Step"),
            Map.entry("NEXT", "Next"),
            Map.entry("DO", "Do"),
            Map.entry("LOOP", "Loop"),
            Map.entry("WHILE", "While"),
            Map.entry("WEND", "Wend"),
            Map.entry("UNTIL", "Until"),
            Map.entry("SUB", "Sub"),
            Map.entry("FUNCTION", "Function"),
            Map.entry("TYPE", "Type"),
            Map.entry("WITH", "With"),
            Map.entry("SELECT", "Select"),
            Map.entry("END", "End"),
            Map.entry("GOTO", "GoTo"),
            Map.entry("GOSUB", "GoSub"),
            Map.entry("RETURN", "Return"),
            Map.entry("DIM", "Dim"),
            Map.entry("INPUT", "Input"),
            Map.entry("OUTPUT", "Output"),
            Map.entry("OUT", "Out"),
            Map.entry("DEBUG", "Debug"),
            Map.entry("DELAY", "Delay"),
            Map.entry("PRINT", "Print"),
            Map.entry("LET", "Let"),
            Map.entry("IN", "In"),
            Map.entry("CONST", "Const"),
            Map.entry("OPTION", "Option"),
            Map.entry("DECLARE", "Declare"),
            Map.entry("PUBLIC", "Public"),
            Map.entry("PRIVATE", "Private"),
            Map.entry("SHARED", "Shared"),
            Map.entry("STATIC", "Static"),
            Map.entry("GLOBAL", "Global"),
            Map.entry("LOCAL", "Local"),
            Map.entry("BYVAL", "ByVal"),
            Map.entry("BYREF", "ByRef"),
            Map.entry("ALIAS", "Alias"),
            Map.entry("LIB", "Lib"));

    private Keywords() {
    }

    public static String label(String keyword) {
        return LABELS.getOrDefault(keyword, keyword);
    }
}
