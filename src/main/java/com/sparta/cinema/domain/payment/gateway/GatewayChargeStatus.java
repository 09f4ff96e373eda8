package com.sparta.cinema.domain.payment.gateway;

/**
 * 대행사 기준 결제 상태
 */
public enum GatewayChargeStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    REFUNDED,
    /**
     * 해당 멱등성 키로 생성된 결제가 없음
     */
    NOT_FOUND
}
