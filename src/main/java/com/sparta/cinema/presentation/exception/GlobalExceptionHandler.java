package com.sparta.cinema.presentation.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 전역 예외 처리 핸들러
 * 모든 예외를 HTTP 응답으로 변환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 비즈니스 예외 처리 (HTTP 상태는 ErrorCode에 정의)
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.warn("비즈니스 예외 - code: {}, message: {}", e.getCode(), e.getMessage(), e);
        } else {
            log.debug("비즈니스 예외 - code: {}, message: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity
            .status(errorCode.getStatus())
            .body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    /**
     * @RequestBody 검증 실패
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getAllErrors().stream()
            .findFirst()
            .map(error -> error instanceof FieldError fieldError
                ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                : error.getDefaultMessage())
            .orElse("입력값이 올바르지 않습니다");

        return ResponseEntity
            .status(ErrorCode.COMMON001.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON001.getCode(), message));
    }

    /**
     * Bean Validation 예외 처리 (@PathVariable, @RequestParam 검증 실패)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
            .findFirst()
            .map(ConstraintViolation::getMessage)
            .orElse("입력값이 올바르지 않습니다");

        return ResponseEntity
            .status(ErrorCode.COMMON001.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON001.getCode(), message));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity
            .status(ErrorCode.COMMON001.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON001.getCode(),
                "필수 파라미터가 누락되었습니다: " + e.getParameterName()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return ResponseEntity
            .status(ErrorCode.COMMON002.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON002.getCode(), ErrorCode.COMMON002.getMessage()));
    }

    /**
     * 낙관적 락 충돌 예외 처리
     * 같은 주문을 동시에 수정한 경우
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(ObjectOptimisticLockingFailureException e) {
        log.info("낙관적 락 충돌 - {}", e.getMessage());
        return ResponseEntity
            .status(ErrorCode.COMMON003.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON003.getCode(), ErrorCode.COMMON003.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        return ResponseEntity
            .status(ErrorCode.COMMON002.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON002.getCode(), e.getMessage()));
    }

    /**
     * 일반 예외 처리
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
            .status(ErrorCode.COMMON004.getStatus())
            .body(new ErrorResponse(ErrorCode.COMMON004.getCode(), ErrorCode.COMMON004.getMessage()));
    }
}
