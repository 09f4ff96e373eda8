package com.sparta.cinema.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * 코드, HTTP 상태, 기본 메시지를 함께 관리
 */
public enum ErrorCode {
    // 영화(카탈로그) 관련 에러
    M001("M001", HttpStatus.NOT_FOUND, "영화를 찾을 수 없습니다"),
    M002("M002", HttpStatus.CONFLICT, "구매할 수 없는 영화입니다"),
    M003("M003", HttpStatus.CONFLICT, "이미 구매한 영화입니다"),

    // 장바구니 관련 에러
    CART001("CART001", HttpStatus.BAD_REQUEST, "장바구니가 비어있습니다"),
    CART002("CART002", HttpStatus.NOT_FOUND, "장바구니 항목을 찾을 수 없습니다"),
    CART003("CART003", HttpStatus.BAD_REQUEST, "수량은 1개 이상 99개 이하여야 합니다"),

    // 주문 관련 에러
    O001("O001", HttpStatus.NOT_FOUND, "주문을 찾을 수 없습니다"),
    O002("O002", HttpStatus.CONFLICT, "현재 주문 상태에서 처리할 수 없는 요청입니다"),
    O003("O003", HttpStatus.CONFLICT, "같은 영화가 포함된 미결제 주문이 이미 있습니다"),
    O004("O004", HttpStatus.FORBIDDEN, "본인의 주문만 처리할 수 있습니다"),
    O005("O005", HttpStatus.CONFLICT, "주문 취소가 불가능합니다"),
    O006("O006", HttpStatus.CONFLICT, "결제 재시도 횟수를 모두 사용했습니다"),
    O007("O007", HttpStatus.CONFLICT, "수동 검토 중인 주문입니다"),
    O008("O008", HttpStatus.CONFLICT, "같은 주문에 대한 요청이 이미 처리 중입니다"),

    // 결제 관련 에러
    PAY001("PAY001", HttpStatus.PAYMENT_REQUIRED, "결제가 거절되었습니다"),
    PAY002("PAY002", HttpStatus.BAD_GATEWAY, "결제 대행사와 통신할 수 없습니다"),
    PAY003("PAY003", HttpStatus.NOT_FOUND, "결제 시도를 찾을 수 없습니다"),

    // 공통 에러
    COMMON001("COMMON001", HttpStatus.BAD_REQUEST, "필수 파라미터가 누락되었습니다"),
    COMMON002("COMMON002", HttpStatus.BAD_REQUEST, "잘못된 요청 형식입니다"),
    COMMON003("COMMON003", HttpStatus.CONFLICT, "동시 요청으로 처리하지 못했습니다. 다시 시도해 주세요"),
    COMMON004("COMMON004", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다");

    private final String code;
    private final HttpStatus status;
    private final String message;

    ErrorCode(String code, HttpStatus status, String message) {
        this.code = code;
        this.status = status;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
