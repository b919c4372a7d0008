package com.cubloc.playground.analysis;

public enum BlockKind {
    IF("If", "End If"),
    FOR("For", "Next"),
    DO("Do", "Loop"),
    WHILE("While", "Wend"),
    SUB("Sub", "End Sub"),
    FUNCTION("Function", "End Function"),
    TYPE("Type", "End Type"),
    WITH("With", "End With"),
    SELECT("Select", "End Select");

    private final String openerLabel;
    private final String closerLabel;

    BlockKind(String openerLabel, String closerLabel) {
        this.openerLabel = openerLabel;
        this.closerLabel = closerLabel;
    }

    public String openerLabel() {
        return openerLabel;
    }

    public String closerLabel() {
        return closerLabel;
    }
}
