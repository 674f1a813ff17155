package com.example.examSchedulerBackend.controller;

import com.example.examSchedulerBackend.model.ApiResponse;
import com.example.examSchedulerBackend.model.ImageAnalysisResponse;
import com.example.examSchedulerBackend.model.ValidationError;
import com.example.examSchedulerBackend.service.UploadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        List<ValidationError> errors = new ArrayList<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.add(new ValidationError(fieldError.getField(), fieldError.getDefaultMessage()));
        }
        log.info("Rejected request body: {}", errors);
        return ResponseEntity.badRequest().body(ApiResponse.failed(errors, new ArrayList<>()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.info("Unreadable request body: {}", e.getMessage());
        List<ValidationError> errors = new ArrayList<>();
        errors.add(new ValidationError("body", "Malformed request body: " + getRootCause(e).getMessage()));
        return ResponseEntity.badRequest().body(ApiResponse.failed(errors, new ArrayList<>()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse> handleBadParameter(Exception e) {
        List<ValidationError> errors = new ArrayList<>();
        errors.add(new ValidationError("request", e.getMessage()));
        return ResponseEntity.badRequest().body(ApiResponse.failed(errors, new ArrayList<>()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse> handleTooLarge(MaxUploadSizeExceededException e) {
        List<ValidationError> errors = new ArrayList<>();
        errors.add(new ValidationError("file", "Uploaded file is too large"));
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(ApiResponse.failed(errors, new ArrayList<>()));
    }

    // only image analysis runs asynchronously
    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ImageAnalysisResponse> handleAsyncTimeout(AsyncRequestTimeoutException e) {
        log.warn("Asynchronous request timed out before image analysis finished");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ImageAnalysisResponse.failure(UploadService.TIMED_OUT));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("Unhandled exception occurred", e);

        Map<String, Object> response = new HashMap<>();
        response.put("error", "Internal Server Error");
        response.put("message", e.getMessage());
        response.put("exception_type", e.getClass().getSimpleName());

        Throwable rootCause = getRootCause(e);
        response.put("root_cause", rootCause.getClass().getSimpleName());
        response.put("root_cause_message", rootCause.getMessage());

        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private Throwable getRootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}
