package com.cubloc.playground.controller;

import com.cubloc.playground.dto.DiagnosticsRequest;
import com.cubloc.playground.dto.DiagnosticsResponse;
import com.cubloc.playground.service.BasicValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/diagnostics")
@Validated
public class DiagnosticsController {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsController.class);

    private final BasicValidationService validationService;

    public DiagnosticsController(BasicValidationService validationService) {
        this.validationService = validationService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<DiagnosticsResponse> analyze(@Valid @RequestBody DiagnosticsRequest request) {
        try {
            logger.debug("Received diagnostics request for {} characters",
                request.sourceCode().length());

            DiagnosticsResponse response = validationService.analyze(request.sourceCode());

            logger.debug("Diagnostics completed: success={}, diagnostics={}",
                response.success(), response.diagnostics().size());

            if (!response.success()) {
                return ResponseEntity.badRequest().body(response);
            }
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during diagnostics", e);
            return ResponseEntity.internalServerError()
                .body(DiagnosticsResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Cubloc BASIC diagnostics service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<DiagnosticsResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = ValidationErrors.describe(e);
        logger.warn("Validation error: {}", message);
        return ResponseEntity.badRequest().body(DiagnosticsResponse.error(message, 0));
    }
}
