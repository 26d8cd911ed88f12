package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.dto.web.ErrorResponse;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Locale;

/** Maps catalog and storage failures to {@code {error, kind, status}} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CatalogException.class)
    public ResponseEntity<ErrorResponse> handleCatalog(CatalogException ex) {
        if (ex.getKind() == ErrorKind.STORAGE_FAILURE) {
            LOGGER.error("Storage failure: {}", ex.getReason(), ex);
        }
        return build(ex.getKind(), ex.getReason());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStorage(DataAccessException ex) {
        LOGGER.error("Storage failure: {}", ex.getMessage(), ex);
        return build(ErrorKind.STORAGE_FAILURE, "STORAGE_FAILURE");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        // enum and timestamp parsers throw CatalogException from inside Jackson
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof CatalogException ce) {
            return build(ce.getKind(), ce.getReason());
        }
        return build(ErrorKind.PARSE_ERROR, "MALFORMED_BODY");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String field = ex.getBindingResult().getFieldError() == null ? "body" : ex.getBindingResult().getFieldError().getField();
        return build(ErrorKind.PARSE_ERROR, "INVALID_" + field.toUpperCase(Locale.ROOT));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        return build(ErrorKind.PARSE_ERROR, "BAD_PARAMETER");
    }

    private static ResponseEntity<ErrorResponse> build(ErrorKind kind, String reason) {
        return ResponseEntity.status(kind.status()).body(new ErrorResponse(reason, kind.name(), kind.status().value()));
    }
}
