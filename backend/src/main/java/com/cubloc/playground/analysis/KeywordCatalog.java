package com.cubloc.playground.analysis;

import com.cubloc.playground.dto.CompletionItem;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static keyword documentation (markdown) and the keyword completion list.
 */
public final class KeywordCatalog {

    private static final Map<String, String> HOVER_DOCS = Map.ofEntries(
            Map.entry("DEBUG", "**Debug** data\n\nSends data to the debug terminal. "
                    + "Use `Dec`/`Hex` for formatted numbers and `CR`/`LF` for line control."),
            Map.entry("DELAY", "**Delay** n\n\nPause for *n* milliseconds."),
            Map.entry("DIM", "**Dim** name [ (dims) ] **As** type [ * length ]\n\n"
                    + "Declare a variable or array. Types: Byte, Integer, Long, Single, String."),
            Map.entry("DO", "**Do** [While|Until cond] … **Loop** [While|Until cond]\n\n"
                    + "Creates a loop; condition may appear on Do or Loop (not both)."),
            Map.entry("LOOP", "**Loop** [While|Until cond]\n\nCloses a Do…Loop block."),
            Map.entry("IN", "**In**(port)\n\nReads the state of a GPIO port."),
            Map.entry("INPUT", "**Input** port\n\nSets the port to high-Z input mode."),
            Map.entry("OUT", "**Out** port, value\n\nWrite logic 1 or 0 to the port."),
            Map.entry("OUTPUT", "**Output** port\n\nSets the port mode to output."),
            Map.entry("PRINT", "**Print** data\n\nPrint to output."),
            Map.entry("LET", "**Let** var = expr\n\nAssign a value."),
            Map.entry("IF", "**If** cond **Then** … [**Else** …] **End If**\n\nConditional block."),
            Map.entry("FOR", "**For** var = start **To** end [**Step** n] … **Next**\n\nCounting loop."));

    private static final List<CompletionItem> COMPLETIONS = List.of(
            CompletionItem.keyword("Print", "Print to output"),
            CompletionItem.keyword("Input", "Set port to input mode"),
            CompletionItem.keyword("Debug", "Debug output"),
            CompletionItem.keyword("Delay", "Pause in milliseconds"),
            CompletionItem.keyword("Output", "Set port to output mode"),
            CompletionItem.keyword("If", "Start conditional"),
            CompletionItem.keyword("Then", "Conditional branch"),
            CompletionItem.keyword("Else", "Conditional branch"),
            CompletionItem.keyword("End If", "End conditional"),
            CompletionItem.keyword("For", "Start loop"),
            CompletionItem.keyword("To", "Loop boundary"),
            CompletionItem.keyword("Step", "Loop step"),
            CompletionItem.keyword("Do", "Start loop"),
            CompletionItem.keyword("Loop", "End loop"),
            CompletionItem.keyword("While", "Loop condition"),
            CompletionItem.keyword("Next", "End loop"),
            CompletionItem.keyword("GoTo", "Jump to label"),
            CompletionItem.keyword("GoSub", "Call subroutine"),
            CompletionItem.keyword("Return", "Return from subroutine"),
            CompletionItem.keyword("Dim", "Declare array"),
            CompletionItem.keyword("End", "End program"));

    private KeywordCatalog() {
    }

    public static Optional<String> documentation(String keyword) {
        return Optional.ofNullable(HOVER_DOCS.get(keyword));
    }

    public static List<CompletionItem> completions() {
        return COMPLETIONS;
    }

    /**
     * Returns the upper-cased word touching {@code character}, or null when the cursor is not on
     * a word or the word starts with a digit.
     */
    public static String wordAt(String line, int character) {
        if (character < 0 || character > line.length()) {
            return null;
        }

        int start = character;
        while (start > 0 && LineScanner.isIdentifierPart(line.charAt(start - 1))) {
            start--;
        }
        int end = LineScanner.identifierEnd(line, character);

        if (start == end || !LineScanner.isIdentifierStart(line.charAt(start))) {
            return null;
        }
        return line.substring(start, end).toUpperCase(Locale.ROOT);
    }
}
