package com.cubloc.playground.analysis;

import java.util.List;

/**
 * Tracks open blocks across the lines of one document and reports nesting mismatches.
 * <p>
 * A closer that matches a frame below the top reports every frame above it as unclosed and
 * discards them together with the match. A closer with no matching frame is reported and leaves
 * the stack alone, so one stray closer does not unwind a legitimate outer block.
 * <p>
 * Instances are single-use: create one per validation pass and call {@link #finish()} after the
 * last line.
 */
public final class BlockNestingValidator {

    private final BlockStack stack = new BlockStack();
    private final DiagnosticCollector diagnostics;

    public BlockNestingValidator(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void validateLine(List<Token> tokens, int line) {
        if (tokens.isEmpty()) {
            return;
        }

        Token keyword = tokens.get(0);
        String second = tokens.size() > 1 ? tokens.get(1).text() : "";

        switch (keyword.text()) {
            case "IF" -> openIf(tokens, line);
            case "ELSEIF" -> requireOpenIf(keyword, line, "ElseIf without matching If.");
            case "ELSE" -> requireOpenIf(keyword, line,
                    second.equals("IF") ? "ElseIf without matching If." : "Else without matching If.");
            case "ENDIF" -> close(BlockKind.IF, keyword, line);
            case "FOR" -> stack.push(BlockKind.FOR, line, keyword);
            case "NEXT" -> close(BlockKind.FOR, keyword, line);
            case "DO" -> validateDoLine(tokens, line);
            case "LOOP" -> closeLoop(tokens, line);
            case "WHILE" -> stack.push(BlockKind.WHILE, line, keyword);
            case "WEND" -> close(BlockKind.WHILE, keyword, line);
            case "SUB", "FUNCTION", "TYPE", "WITH", "SELECT" ->
                    stack.push(BlockKind.valueOf(keyword.text()), line, keyword);
            case "END" -> closeEnd(second, keyword, line);
            default -> {
            }
        }
    }

    /**
     * Reports every block still open after the last line, innermost first.
     */
    public void finish() {
        while (!stack.isEmpty()) {
            BlockFrame open = stack.pop();
            diagnostics.error(open, "Missing " + open.kind().closerLabel()
                    + " for " + open.kind().openerLabel() + ".");
        }
    }

    public List<BlockFrame> openBlocks() {
        return stack.frames();
    }

    private void openIf(List<Token> tokens, int line) {
        int thenIndex = indexOf(tokens, "THEN");
        if (thenIndex == -1) {
            diagnostics.error(line, tokens.get(0), "If without Then.");
        } else if (thenIndex == tokens.size() - 1) {
            stack.push(BlockKind.IF, line, tokens.get(0));
        }
    }

    private void requireOpenIf(Token keyword, int line, String message) {
        if (!stack.hasOpen(BlockKind.IF)) {
            diagnostics.error(line, keyword, message);
        }
    }

    private void closeEnd(String second, Token keyword, int line) {
        switch (second) {
            case "IF", "SUB", "FUNCTION", "SELECT", "TYPE", "WITH" ->
                    close(BlockKind.valueOf(second), keyword, line);
            default -> {
            }
        }
    }

    private BlockFrame close(BlockKind kind, Token closer, int line) {
        String closerLabel = kind.closerLabel();

        int depth = stack.findOpen(kind);
        if (depth == -1) {
            diagnostics.error(line, closer, closerLabel + " without matching " + kind.openerLabel() + ".");
            return null;
        }

        if (depth == stack.size() - 1) {
            return stack.pop();
        }

        for (BlockFrame skipped : stack.above(depth)) {
            diagnostics.error(skipped, "Missing " + skipped.kind().closerLabel() + " before " + closerLabel + ".");
        }
        return stack.truncate(depth);
    }

    private void validateDoLine(List<Token> tokens, int line) {
        int loopIndex = indexOf(tokens, "LOOP");
        if (loopIndex == -1) {
            openDo(tokens, line);
            return;
        }
        openDo(tokens.subList(0, loopIndex), line);
        closeLoop(tokens.subList(loopIndex, tokens.size()), line);
    }

    private void openDo(List<Token> tokens, int line) {
        LoopCondition condition = parseCondition(tokens, line, "Do");
        if (condition != null && condition.malformed()) {
            return;
        }

        BlockFrame frame = stack.push(BlockKind.DO, line, tokens.get(0));
        if (condition != null) {
            frame.attachCondition(LoopCondition.Placement.DO, condition.kind());
        }
    }

    private void closeLoop(List<Token> tokens, int line) {
        LoopCondition condition = parseCondition(tokens, line, "Loop");
        if (condition != null && condition.malformed()) {
            return;
        }

        Token loop = tokens.get(0);
        BlockFrame frame = close(BlockKind.DO, loop, line);
        if (frame != null && condition != null && frame.conditionPlacement() == LoopCondition.Placement.DO) {
            diagnostics.error(line, loop, "Loop cannot include a condition when Do already has While/Until.");
        }
    }

    /**
     * Reads the While/Until clause of a {@code DO} or {@code LOOP} keyword, which is
     * {@code tokens.get(0)}. Returns null when there is no clause.
     */
    private LoopCondition parseCondition(List<Token> tokens, int line, String context) {
        Token immediate = tokens.size() > 1 ? tokens.get(1) : null;
        boolean immediateIsCondition = immediate != null && isConditionKeyword(immediate);

        Token whileToken = null;
        Token untilToken = null;
        for (int i = 1; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is("WHILE")) {
                whileToken = token;
            } else if (token.is("UNTIL")) {
                untilToken = token;
            }
        }

        if (!immediateIsCondition && (whileToken != null || untilToken != null)) {
            Token misplaced = whileToken != null ? whileToken : untilToken;
            diagnostics.error(line, misplaced, context + " While/Until must immediately follow " + context + ".");
            return LoopCondition.malformed(kindOf(misplaced));
        }

        if (whileToken != null && untilToken != null) {
            diagnostics.error(line,
                    Math.min(whileToken.index(), untilToken.index()),
                    Math.max(whileToken.end(), untilToken.end()),
                    context + " cannot use both While and Until.");
            return LoopCondition.malformed(kindOf(immediate));
        }

        if (!immediateIsCondition) {
            return null;
        }

        if (immediate == tokens.get(tokens.size() - 1)) {
            diagnostics.error(line, immediate,
                    context + " " + Keywords.label(immediate.text()) + " requires a condition.");
            return LoopCondition.malformed(kindOf(immediate));
        }

        return LoopCondition.wellFormed(kindOf(immediate));
    }

    private static boolean isConditionKeyword(Token token) {
        return token.is("WHILE") || token.is("UNTIL");
    }

    private static LoopCondition.Kind kindOf(Token token) {
        return LoopCondition.Kind.valueOf(token.text());
    }

    private static int indexOf(List<Token> tokens, String keyword) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(keyword)) {
                return i;
            }
        }
        return -1;
    }
}
