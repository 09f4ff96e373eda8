package com.sparta.cinema.domain.notification;

import java.math.BigDecimal;

/**
 * 알림 작업 내용
 */
public record NotificationPayload(
        String orderId,
        String userId,
        BigDecimal amount,
        String detail
) {
}
