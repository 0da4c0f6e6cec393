package com.adlanda.dailytoon.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;

/**
 * Maps pipeline failures to RFC 7807 problem details.
 *
 * Upstream diagnostics (raw model output, upstream status codes) are logged
 * here and never copied into the response body. Standard Spring MVC errors
 * (validation, unreadable bodies) are rendered by the base class.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_BASE = "https://dailytoon.app/errors/";

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.info("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "not-found", "Not Found", ex.getResource() + " not found");
    }

    @ExceptionHandler(SynthesisException.class)
    public ProblemDetail handleSynthesis(SynthesisException ex) {
        if (ex.isPermanent()) {
            log.error("Image generation rejected (status {}): {}", ex.getLastStatus(), ex.getMessage());
            return problem(HttpStatus.UNPROCESSABLE_ENTITY, "image-rejected", "Image Rejected",
                    "The image service could not render this panel. Try editing the scene.");
        }
        log.error("Image generation unavailable (last status {}): {}", ex.getLastStatus(), ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "image-unavailable", "Image Service Unavailable",
                "The image service is temporarily unavailable. Please retry later.");
    }

    @ExceptionHandler(DecompositionException.class)
    public ProblemDetail handleDecomposition(DecompositionException ex) {
        if (ex.getCause() instanceof ExtractionException extraction) {
            log.error("Storyboard extraction failed, raw response: {}", extraction.getRawText());
        }
        log.error("Storyboard decomposition failed: {}", ex.getMessage(), ex);
        return problem(HttpStatus.BAD_GATEWAY, "storyboard-failed", "Storyboard Failed",
                "The story could not be turned into panels. Please try again.");
    }

    @ExceptionHandler(ExtractionException.class)
    public ProblemDetail handleExtraction(ExtractionException ex) {
        log.error("Unparseable model response: {}", ex.getRawText());
        return problem(HttpStatus.BAD_GATEWAY, "storyboard-failed", "Storyboard Failed",
                "The story could not be turned into panels. Please try again.");
    }

    @ExceptionHandler(StoreException.class)
    public ProblemDetail handleStore(StoreException ex) {
        log.error("Episode store failure: {}", ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "store-unavailable", "Storage Unavailable",
                "Episodes are temporarily unavailable. Please retry later.");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal Server Error",
                "An unexpected error occurred. Please try again later.");
    }

    private ProblemDetail problem(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
