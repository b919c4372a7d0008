package com.cubloc.playground.analysis;

public record Token(String text, int index, int length) {

    public int end() {
        return index + length;
    }

    public boolean is(String keyword) {
        return text.equals(keyword);
    }
}
