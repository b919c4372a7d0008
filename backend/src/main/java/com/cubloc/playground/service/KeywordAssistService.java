package com.cubloc.playground.service;

import com.cubloc.playground.analysis.KeywordCatalog;
import com.cubloc.playground.analysis.Keywords;
import com.cubloc.playground.analysis.LineScanner;
import com.cubloc.playground.dto.CompletionItem;
import com.cubloc.playground.dto.HoverRequest;
import com.cubloc.playground.dto.HoverResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Keyword hover documentation and completions. Neither depends on validation results.
 */
@Service
public class KeywordAssistService {

    private static final Logger logger = LoggerFactory.getLogger(KeywordAssistService.class);

    private final DocumentStore documentStore;

    public KeywordAssistService(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public Optional<HoverResponse> hover(HoverRequest request) {
        Optional<String> text = documentStore.get(request.uri());
        if (text.isEmpty()) {
            logger.debug("Hover requested for unknown document {}", request.uri());
            return Optional.empty();
        }

        String[] lines = LineScanner.splitLines(text.get());
        String lineText = request.line() < lines.length ? lines[request.line()] : "";

        String word = KeywordCatalog.wordAt(lineText, request.character());
        if (word == null) {
            return Optional.empty();
        }

        return KeywordCatalog.documentation(word)
                .map(contents -> HoverResponse.markdown(word, Keywords.label(word), contents));
    }

    public List<CompletionItem> completions() {
        return KeywordCatalog.completions();
    }
}
