package com.sparta.cinema.infrastructure.kafka.notification.message;

import com.sparta.cinema.domain.notification.NotificationJobType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Kafka 알림 메시지
 *
 * @param messageId 소비자 중복 제거 키
 */
public record NotificationMessage(
        String messageId,
        NotificationJobType jobType,
        String orderId,
        String userId,
        BigDecimal amount,
        String detail,
        LocalDateTime occurredAt
) {
}
