package com.cubloc.playground.analysis;

public final class BlockFrame {

    private final BlockKind kind;
    private final int line;
    private final int column;
    private final int length;

    private LoopCondition.Placement conditionPlacement;
    private LoopCondition.Kind conditionKind;

    public BlockFrame(BlockKind kind, int line, Token opener) {
        this.kind = kind;
        this.line = line;
        this.column = opener.index();
        this.length = opener.length();
    }

    public BlockKind kind() {
        return kind;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int endColumn() {
        return column + length;
    }

    public LoopCondition.Placement conditionPlacement() {
        return conditionPlacement;
    }

    public LoopCondition.Kind conditionKind() {
        return conditionKind;
    }

    void attachCondition(LoopCondition.Placement placement, LoopCondition.Kind kind) {
        if (this.kind != BlockKind.DO) {
            throw new IllegalStateException("Only Do blocks carry a loop condition, not " + this.kind);
        }
        this.conditionPlacement = placement;
        this.conditionKind = kind;
    }

    @Override
    public String toString() {
        return kind + "@" + line + ":" + column;
    }
}
