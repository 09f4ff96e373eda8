package com.sparta.cinema.domain.notification;

/**
 * 알림 작업 종류
 */
public enum NotificationJobType {
    PAYMENT_SUCCEEDED,
    PAYMENT_FAILED,
    ORDER_CANCELLED,
    ORDER_REFUNDED,
    /**
     * 운영자 수동 검토 요청 (이중 결제 등)
     */
    PAYMENT_ANOMALY
}
