package com.cubloc.playground.analysis;

/**
 * The While/Until clause found after a {@code DO} or {@code LOOP} keyword.
 * A malformed clause has already been reported and leaves the block stack untouched.
 */
public record LoopCondition(Kind kind, boolean malformed) {

    public enum Kind {
        WHILE,
        UNTIL
    }

    public enum Placement {
        DO,
        LOOP
    }

    static LoopCondition wellFormed(Kind kind) {
        return new LoopCondition(kind, false);
    }

    static LoopCondition malformed(Kind kind) {
        return new LoopCondition(kind, true);
    }
}
