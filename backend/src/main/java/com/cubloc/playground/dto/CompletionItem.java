package com.cubloc.playground.dto;

public record CompletionItem(
    String label,
    int kind,
    String detail
) {
    public static final int KEYWORD_KIND = 14;

    public static CompletionItem keyword(String label, String detail) {
        return new CompletionItem(label, KEYWORD_KIND, detail);
    }
}
