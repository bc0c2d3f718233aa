package com.pharmaintel.exception;

import com.pharmaintel.config.RequestIdFilter;
import com.pharmaintel.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
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

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_ERROR",
                     "One or more fields failed validation", request, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be parsed", request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "TYPE_MISMATCH", msg, request, null);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficientData(
            InsufficientDataException ex, HttpServletRequest request) {
        log.info("Insufficient data | itemId={} | periods={} | required={}",
                 ex.getItemId(), ex.getAvailablePeriods(), ex.getRequiredPeriods());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidEngineInputException.class)
    public ResponseEntity<ApiError> handleInvalidInput(
            InvalidEngineInputException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Input", ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            JobNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(BatchSizeExceededException.class)
    public ResponseEntity<ApiError> handleBatchTooLarge(
            BatchSizeExceededException ex, HttpServletRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Batch Too Large", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(RuleBaseLoadException.class)
    public ResponseEntity<ApiError> handleRuleBaseLoad(
            RuleBaseLoadException ex, HttpServletRequest request) {
        log.error("Rule base load failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Rule Base Unavailable", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(InventoryIntelligenceException.class)
    public ResponseEntity<ApiError> handleEngine(
            InventoryIntelligenceException ex, HttpServletRequest request) {
        log.error("Engine error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Engine Error", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String code, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        Object attribute = request.getAttribute(RequestIdFilter.MDC_KEY);
        String reqId = attribute != null ? attribute.toString()
                : request.getHeader(RequestIdFilter.REQUEST_ID_HEADER);

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(reqId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
