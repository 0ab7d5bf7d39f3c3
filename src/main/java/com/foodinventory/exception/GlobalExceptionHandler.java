package com.foodinventory.exception;

import com.foodinventory.dto.ErrorResponse;
import com.foodinventory.dto.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 전역 예외 처리 핸들러
 *
 * 모든 예외를 일관된 형식의 ErrorResponse로 변환하여 반환합니다.
 * HTTP 상태코드와 비즈니스 코드를 함께 반환합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 필수 항목 누락 처리
     * 항목별 누락 여부(missingFields)를 함께 내려줍니다.
     */
    @ExceptionHandler(RequiredFieldsMissingException.class)
    public ResponseEntity<ErrorResponse> handleRequiredFieldsMissingException(RequiredFieldsMissingException e) {
        log.warn("RequiredFieldsMissingException: missingFields={}", e.getMissingFields());

        ErrorResponse response = ErrorResponse.withMissingFields(e.getResponseCode(), e.getMissingFields());
        return ResponseEntity
                .status(e.getResponseCode().getHttpStatus())
                .body(response);
    }

    /**
     * BusinessException 처리
     * 5xx 코드는 원인 예외까지 error 레벨로 남깁니다.
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        if (e.getResponseCode().getHttpStatus().is5xxServerError()) {
            log.error("BusinessException: code={}, message={}", e.getResponseCode().getCode(), e.getErrorMessage(), e);
        } else {
            log.warn("BusinessException: code={}, message={}", e.getResponseCode().getCode(), e.getErrorMessage());
        }

        ErrorResponse response = ErrorResponse.of(e.getResponseCode(), e.getErrorMessage());
        return ResponseEntity
                .status(e.getResponseCode().getHttpStatus())
                .body(response);
    }

    /**
     * Validation 예외 처리
     * @Valid 검증 실패 시 발생합니다.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String errorMessage = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        log.warn("ValidationException: {}", errorMessage);

        ErrorResponse response = ErrorResponse.of(ResponseCode.BAD_REQUEST, errorMessage);
        return ResponseEntity
                .status(ResponseCode.BAD_REQUEST.getHttpStatus())
                .body(response);
    }

    /**
     * 요청 본문을 읽을 수 없는 경우 (JSON 형식 오류, 타입 불일치)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        log.warn("HttpMessageNotReadableException: {}", e.getMessage());

        ErrorResponse response = ErrorResponse.of(ResponseCode.BAD_REQUEST, "요청 본문 형식이 올바르지 않습니다.");
        return ResponseEntity
                .status(ResponseCode.BAD_REQUEST.getHttpStatus())
                .body(response);
    }

    /**
     * IllegalArgumentException 처리
     * 잘못된 인자가 전달된 경우 발생합니다.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("IllegalArgumentException: {}", e.getMessage());

        ErrorResponse response = ErrorResponse.of(ResponseCode.BAD_REQUEST, e.getMessage());
        return ResponseEntity
                .status(ResponseCode.BAD_REQUEST.getHttpStatus())
                .body(response);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
        log.warn("NoResourceFoundException: {}", e.getResourcePath());

        ErrorResponse response = ErrorResponse.of(ResponseCode.NOT_FOUND);
        return ResponseEntity
                .status(ResponseCode.NOT_FOUND.getHttpStatus())
                .body(response);
    }

    /**
     * 저장소 예외 처리
     * 서비스에서 변환되지 않은 영속성 계층 오류입니다. 트랜잭션을 시작하지 못한 경우(DB 연결 실패)도 포함합니다.
     */
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(RuntimeException e) {
        log.error("StoreException: ", e);

        ErrorResponse response = ErrorResponse.of(ResponseCode.INVENTORY_STORE_ERROR);
        return ResponseEntity
                .status(ResponseCode.INVENTORY_STORE_ERROR.getHttpStatus())
                .body(response);
    }

    /**
     * 그 외 모든 예외 처리
     * 예상하지 못한 예외가 발생한 경우입니다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("UnexpectedException: ", e);

        ErrorResponse response = ErrorResponse.of(ResponseCode.INTERNAL_SERVER_ERROR);
        return ResponseEntity
                .status(ResponseCode.INTERNAL_SERVER_ERROR.getHttpStatus())
                .body(response);
    }
}
