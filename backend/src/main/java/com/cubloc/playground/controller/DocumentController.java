package com.cubloc.playground.controller;

import com.cubloc.playground.dto.DiagnosticsResponse;
import com.cubloc.playground.dto.DocumentChangeRequest;
import com.cubloc.playground.dto.DocumentCloseRequest;
import com.cubloc.playground.dto.HoverRequest;
import com.cubloc.playground.dto.HoverResponse;
import com.cubloc.playground.exception.DocumentNotOpenException;
import com.cubloc.playground.service.DocumentService;
import com.cubloc.playground.service.KeywordAssistService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.function.Supplier;

/**
 * Document lifecycle used by the editor: every open or change carries the full text and is
 * answered with the complete diagnostic list for it.
 */
@RestController
@RequestMapping("/api/documents")
@Validated
public class DocumentController {

    private static final Logger logger = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentService documentService;
    private final KeywordAssistService keywordAssistService;

    public DocumentController(DocumentService documentService, KeywordAssistService keywordAssistService) {
        this.documentService = documentService;
        this.keywordAssistService = keywordAssistService;
    }

    @PostMapping("/open")
    public ResponseEntity<DiagnosticsResponse> open(@Valid @RequestBody DocumentChangeRequest request) {
        return respond(() -> documentService.open(request));
    }

    @PostMapping("/change")
    public ResponseEntity<DiagnosticsResponse> change(@Valid @RequestBody DocumentChangeRequest request) {
        return respond(() -> documentService.change(request));
    }

    @PostMapping("/close")
    public ResponseEntity<DiagnosticsResponse> close(@Valid @RequestBody DocumentCloseRequest request) {
        return ResponseEntity.ok(documentService.close(request.uri()));
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<DiagnosticsResponse> diagnostics(@RequestParam String uri)
            throws DocumentNotOpenException {
        DiagnosticsResponse response = documentService.diagnostics(uri);
        return respond(() -> response);
    }

    @PostMapping("/hover")
    public ResponseEntity<HoverResponse> hover(@Valid @RequestBody HoverRequest request) {
        return keywordAssistService.hover(request)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @ExceptionHandler(DocumentNotOpenException.class)
    public ResponseEntity<DiagnosticsResponse> handleDocumentNotOpen(DocumentNotOpenException e) {
        logger.debug("{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(DiagnosticsResponse.error(e.getMessage(), 0));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<DiagnosticsResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = ValidationErrors.describe(e);
        logger.warn("Validation error: {}", message);
        return ResponseEntity.badRequest().body(DiagnosticsResponse.error(message, 0));
    }

    private ResponseEntity<DiagnosticsResponse> respond(Supplier<DiagnosticsResponse> action) {
        DiagnosticsResponse response;
        try {
            response = action.get();
        } catch (RuntimeException e) {
            logger.error("Unexpected error while handling document request: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(DiagnosticsResponse.error("Internal server error: " + e.getMessage(), 0));
        }

        logger.debug("Document {} validated: success={}, diagnostics={}",
            response.uri(), response.success(), response.diagnostics().size());

        if (!response.success()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
