package com.sparta.cinema.domain.payment;

/**
 * 결제 이상 유형
 */
public enum AnomalyType {
    /**
     * 이미 결제 완료된 주문에 두 번째 승인이 들어옴
     */
    DOUBLE_PAYMENT,

    /**
     * 취소된 주문의 결제 시도가 뒤늦게 승인됨
     */
    PAYMENT_AFTER_CANCEL,

    /**
     * 실패/만료로 정리한 시도가 뒤늦게 승인됨 (주문은 아직 결제 전)
     */
    LATE_PAYMENT
}
