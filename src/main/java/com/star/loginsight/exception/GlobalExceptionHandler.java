package com.star.loginsight.exception;

import com.star.loginsight.dto.ApiResponse;
import com.star.loginsight.dto.ErrorResponse;
import com.star.loginsight.dto.ValidationError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ApiResponse<Void>> handleConfig(
            ConfigException ex,
            HttpServletRequest request) {

        log.error("Invalid analysis configuration: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "CONFIG_ERROR",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );
        errorResponse.setRuleId(ex.getRuleId());
        errorResponse.setField(ex.getField());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid configuration", errorResponse));
    }

    @ExceptionHandler(FileSizeLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleFileSizeLimitExceeded(
            FileSizeLimitExceededException ex,
            HttpServletRequest request) {

        log.error("File size limit exceeded: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "FILE_SIZE_LIMIT_EXCEEDED",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.PAYLOAD_TOO_LARGE.value()
        );

        return ResponseEntity
                .status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error("File size exceeds the allowed limit", errorResponse));
    }

    @ExceptionHandler(LogReadException.class)
    public ResponseEntity<ApiResponse<Void>> handleLogRead(
            LogReadException ex,
            HttpServletRequest request) {

        log.error("Failed to read log input: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "LOG_READ_ERROR",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Failed to read log input", errorResponse));
    }

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<ApiResponse<Void>> handleAnalysis(
            AnalysisException ex,
            HttpServletRequest request) {

        log.error("Analysis error: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
                "ANALYSIS_ERROR",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Analysis failed", errorResponse));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSizeExceeded(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request) {

        log.error("Max upload size exceeded: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "MAX_UPLOAD_SIZE_EXCEEDED",
                "File size exceeds the maximum allowed size for upload",
                request.getRequestURI(),
                HttpStatus.PAYLOAD_TOO_LARGE.value()
        );

        return ResponseEntity
                .status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error("File too large", errorResponse));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ValidationError> validationErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new ValidationError(error.getField(), error.getDefaultMessage()))
                .sorted(Comparator.comparing(ValidationError::getField))
                .collect(Collectors.toList());

        return validationFailed(validationErrors, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolations(
            ConstraintViolationException ex,
            HttpServletRequest request) {

        List<ValidationError> validationErrors = ex.getConstraintViolations()
                .stream()
                .map(violation -> new ValidationError(
                        violation.getPropertyPath().toString(), violation.getMessage()))
                .sorted(Comparator.comparing(ValidationError::getField))
                .collect(Collectors.toList());

        return validationFailed(validationErrors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        log.error("Malformed request body: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "Request body is missing or malformed",
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Malformed request", errorResponse));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
            Exception ex,
            HttpServletRequest request) {

        log.error("Missing request parameter: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "MISSING_PARAMETER",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Missing required parameter", errorResponse));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI(),
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Internal server error", errorResponse));
    }

    private ResponseEntity<ApiResponse<Void>> validationFailed(
            List<ValidationError> validationErrors,
            HttpServletRequest request) {

        log.error("Request validation failed: {}", validationErrors);

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "Validation failed for one or more fields",
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value(),
                validationErrors
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Validation failed", errorResponse));
    }
}
