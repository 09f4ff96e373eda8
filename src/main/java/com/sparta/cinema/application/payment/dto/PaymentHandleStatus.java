package com.sparta.cinema.application.payment.dto;

/**
 * 결제 시작 결과
 */
public enum PaymentHandleStatus {
    /**
     * 대행사가 접수함. 사용자는 redirectUrl에서 결제를 마친다
     */
    PENDING,

    /**
     * 대행사 응답을 받지 못함. 결과는 콜백 또는 대사로 확정된다
     */
    UNKNOWN
}
