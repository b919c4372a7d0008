package com.cubloc.playground.dto;

public record HoverResponse(
        String keyword,
        String label,
        String kind,
        String contents) {

    public static HoverResponse markdown(String keyword, String label, String contents) {
        return new HoverResponse(keyword, label, "markdown", contents);
    }
}
