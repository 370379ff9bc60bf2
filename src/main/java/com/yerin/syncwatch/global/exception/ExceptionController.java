package com.yerin.syncwatch.global.exception;

import com.yerin.syncwatch.global.dto.ErrorResponse;
import com.yerin.syncwatch.global.exception.code.CommonErrorCode;
import com.yerin.syncwatch.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI(), e);
        } else {
            log.warn("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI());
        }

        ErrorResponse body = ErrorResponse.of(errorCode, request);
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String msg = (fieldError != null)
                ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                : "입력값이 유효하지 않습니다.";

        ErrorCode errorCode = CommonErrorCode.INVALID_PARAMETER.withDetail(msg);
        log.warn("Validation failed: {}, path={} {}", msg,
                request.getMethod(), request.getRequestURI());

        ErrorResponse body = ErrorResponse.of(errorCode, request);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                          HttpServletRequest request) {
        log.warn("Unreadable body: {}, path={} {}", e.getMostSpecificCause().getMessage(),
                request.getMethod(), request.getRequestURI());
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.MALFORMED_BODY, request);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                            HttpServletRequest request) {
        String msg = e.getName() + ": " + e.getValue() + " 값을 해석할 수 없습니다.";
        log.warn("Type mismatch: {}, path={} {}", msg, request.getMethod(), request.getRequestURI());
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.INVALID_PARAMETER.withDetail(msg), request);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException e,
                                                          HttpServletRequest request) {
        log.debug("No such path: {} {}", request.getMethod(), request.getRequestURI());
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.NO_SUCH_PATH, request);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(InterruptedException.class)
    public ResponseEntity<ErrorResponse> handleInterrupted(InterruptedException e,
                                                           HttpServletRequest request) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while serving path={} {}", request.getMethod(), request.getRequestURI());
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.INTERRUPTED, request);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
