package com.teambind.lottery.common.exceptions;

import com.teambind.lottery.domain.exception.InconsistentStateException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 전역 예외 처리
 * 예상 가능한 실패(NOT_FOUND, INVALID_STATE, CONFLICT)는 결과 객체로 처리되므로 여기 오지 않는다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(InconsistentStateException.class)
    public ResponseEntity<ErrorResponse> handleInconsistentState(InconsistentStateException ex,
                                                                 HttpServletRequest request) {
        log.error("[INCONSISTENT] 정합성 오류 - operation: {}, targetId: {}, path: {}, message: {}",
                ex.getOperation(), ex.getTargetId(), request.getRequestURI(), ex.getMessage(), ex);

        ErrorResponse body = ErrorResponse.of(ErrorCode.INCONSISTENT_STATE, ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(ErrorCode.INCONSISTENT_STATE.getStatus()).body(body);
    }

    @ExceptionHandler(CustomException.class)
    public ResponseEntity<ErrorResponse> handleCustomException(CustomException ex, HttpServletRequest request) {
        log.warn("요청 처리 실패 - code: {}, path: {}, message: {}",
                ex.getErrorCode().getErrCode(), request.getRequestURI(), ex.getMessage());

        ErrorResponse body = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(ex.getErrorCode().getStatus()).body(body);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex,
                                                                   HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(ErrorCode.INVALID_INPUT, ex.getMessage(), request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("처리되지 않은 예외 - path: {}, error: {}", request.getRequestURI(), ex.getMessage(), ex);

        ErrorResponse body = ErrorResponse.of(ErrorCode.INTERNAL_ERROR,
                ErrorCode.INTERNAL_ERROR.getDefaultMessage(), request.getRequestURI());
        return ResponseEntity.internalServerError().body(body);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
                                                                  HttpHeaders headers,
                                                                  HttpStatusCode status,
                                                                  WebRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fieldErrors.put(error.getField(), error.getDefaultMessage()));

        ErrorResponse body = ErrorResponse.builder()
                .timestamp(java.time.LocalDateTime.now())
                .status(ErrorCode.INVALID_INPUT.getStatus().value())
                .code(ErrorCode.INVALID_INPUT.getErrCode())
                .message(ErrorCode.INVALID_INPUT.getDefaultMessage())
                .path(request.getDescription(false).replace("uri=", ""))
                .fieldErrors(fieldErrors)
                .build();

        return ResponseEntity.badRequest().body(body);
    }
}
