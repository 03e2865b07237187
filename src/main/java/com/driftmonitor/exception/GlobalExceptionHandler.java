package com.driftmonitor.exception;

import com.driftmonitor.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, null, fieldErrors);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ApiError> handleConstraintViolation(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Constraint Violation", ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body could not be parsed", request, null, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, null, null);
    }

    @ExceptionHandler({UnknownModelException.class, AlertNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            DriftMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficientData(
            InsufficientDataException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(AlertStateException.class)
    public ResponseEntity<ApiError> handleAlertState(
            AlertStateException ex, HttpServletRequest request) {
        log.warn("Rejected alert transition: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Illegal Alert Transition", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
