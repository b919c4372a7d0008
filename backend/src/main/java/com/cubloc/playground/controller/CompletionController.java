package com.cubloc.playground.controller;

import com.cubloc.playground.dto.CompletionItem;
import com.cubloc.playground.service.KeywordAssistService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/completion")
public class CompletionController {

    private final KeywordAssistService keywordAssistService;

    public CompletionController(KeywordAssistService keywordAssistService) {
        this.keywordAssistService = keywordAssistService;
    }

    @GetMapping
    public ResponseEntity<List<CompletionItem>> completions() {
        return ResponseEntity.ok(keywordAssistService.completions());
    }
}
