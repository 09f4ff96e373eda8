package com.sparta.cinema.application.payment.dto;

/**
 * 콜백 처리 결과
 */
public enum CallbackResult {
    /**
     * 주문/결제 상태에 반영됨
     */
    APPLIED,

    /**
     * 이미 처리된 메시지 또는 이미 종결된 시도. 아무것도 바뀌지 않음
     */
    DUPLICATE,

    /**
     * 이중 결제 등 이상 상황으로 기록되고 주문이 동결됨
     */
    ANOMALY
}
