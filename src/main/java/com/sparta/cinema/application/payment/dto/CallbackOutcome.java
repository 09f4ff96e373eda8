package com.sparta.cinema.application.payment.dto;

/**
 * 대행사 콜백이 알려주는 결제 결과
 */
public enum CallbackOutcome {
    SUCCEEDED,
    FAILED,
    REFUNDED
}
