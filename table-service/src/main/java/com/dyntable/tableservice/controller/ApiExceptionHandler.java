package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.ErrorResponse;
import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.enums.StatusCategory;
import com.dyntable.tableservice.exception.TableEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 将引擎异常映射为对应状态码和统一的错误响应体
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TableEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(TableEngineException e) {
        StatusCategory status = e.getStatus();
        if (status == StatusCategory.INTERNAL) {
            log.error("Internal engine error: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected with {}: {}", status, e.getMessage());
        }
        return build(status, e.getMessage(), e.getErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        List<FieldError> errors = e.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldError(error.getField(), error.getRejectedValue(), error.getDefaultMessage()))
                .collect(Collectors.toList());
        return build(StatusCategory.VALIDATION_FAILED,
                String.format("Validation failed for %d field(s)", errors.size()), errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return build(StatusCategory.VALIDATION_FAILED, "Malformed request body", List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return build(StatusCategory.INTERNAL, "Internal error", List.of());
    }

    private ResponseEntity<ErrorResponse> build(StatusCategory status, String message, List<FieldError> errors) {
        ErrorResponse body = ErrorResponse.builder()
                .error(status.name())
                .message(message)
                .status(status.getHttpStatus())
                .errors(errors)
                .timestamp(LocalDateTime.now())
                .build();
        return ResponseEntity.status(status.getHttpStatus()).body(body);
    }
}
