package com.eainde.relviz.controller;

import com.eainde.relviz.fact.FactSyntaxException;
import com.eainde.relviz.graph.GraphException;
import com.eainde.relviz.model.FactModelException;
import com.eainde.relviz.render.RenderException;
import com.eainde.relviz.render.UnknownProcessorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline failures to plain-text responses the form page can show.
 *
 * <ul>
 *   <li>400: malformed facts, inconsistent models or containment, missing
 *       form fields</li>
 *   <li>501: unsupported layout engine</li>
 *   <li>500: the layout engine failed, or anything unexpected</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FactSyntaxException.class)
    public ResponseEntity<String> handleSyntax(FactSyntaxException e) {
        log.warn("Syntax error at line {}, column {}: {}", e.getLine(), e.getColumn(), e.getMessage());
        return text(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({FactModelException.class, GraphException.class})
    public ResponseEntity<String> handleModel(RuntimeException e) {
        log.warn("Rejected facts: {}", e.getMessage());
        return text(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<String> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing parameter: {}", e.getParameterName());
        return text(HttpStatus.BAD_REQUEST, "Missing parameter: " + e.getParameterName());
    }

    @ExceptionHandler(UnknownProcessorException.class)
    public ResponseEntity<String> handleUnknownProcessor(UnknownProcessorException e) {
        log.warn(e.getMessage());
        return text(HttpStatus.NOT_IMPLEMENTED, e.getMessage());
    }

    @ExceptionHandler(RenderException.class)
    public ResponseEntity<String> handleRender(RenderException e) {
        log.error("Layout engine failed (exit code {}): {}", e.getExitCode(), e.getMessage(), e);
        return text(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return text(HttpStatus.INTERNAL_SERVER_ERROR, e.toString());
    }

    private static ResponseEntity<String> text(HttpStatus status, String body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
