package com.cubloc.playground.service;

import com.cubloc.playground.dto.DiagnosticsResponse;
import com.cubloc.playground.dto.DocumentChangeRequest;
import com.cubloc.playground.exception.DocumentNotOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentStore documentStore;
    private final BasicValidationService validationService;

    public DocumentService(DocumentStore documentStore, BasicValidationService validationService) {
        this.documentStore = documentStore;
        this.validationService = validationService;
    }

    public DiagnosticsResponse open(DocumentChangeRequest request) {
        DiagnosticsResponse response = update(request);
        logger.info("Opened document {} (version {}, {} open)",
                request.uri(), request.version(), documentStore.size());
        return response;
    }

    public DiagnosticsResponse change(DocumentChangeRequest request) {
        logger.debug("Changed document {} (version {})", request.uri(), request.version());
        return update(request);
    }

    public DiagnosticsResponse close(String uri) {
        if (documentStore.remove(uri)) {
            logger.info("Closed document {}", uri);
        } else {
            logger.debug("Close requested for unknown document {}", uri);
        }
        return DiagnosticsResponse.success(List.of(), 0).forDocument(uri, null);
    }

    public DiagnosticsResponse diagnostics(String uri) throws DocumentNotOpenException {
        String text = documentStore.get(uri)
                .orElseThrow(() -> new DocumentNotOpenException(uri));
        return validationService.analyze(text).forDocument(uri, null);
    }

    // Rejected text is never cached; a stale earlier version is dropped with it.
    private DiagnosticsResponse update(DocumentChangeRequest request) {
        DiagnosticsResponse response = validationService.analyze(request.text());
        if (response.success()) {
            documentStore.put(request.uri(), request.text());
        } else if (documentStore.remove(request.uri())) {
            logger.warn("Dropped cached document {}: {}", request.uri(), response.error());
        }
        return response.forDocument(request.uri(), request.version());
    }
}
