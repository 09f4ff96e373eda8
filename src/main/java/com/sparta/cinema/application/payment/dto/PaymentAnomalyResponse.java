package com.sparta.cinema.application.payment.dto;

import com.sparta.cinema.domain.payment.AnomalyType;
import com.sparta.cinema.domain.payment.entity.PaymentAnomaly;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

/**
 * 결제 이상 기록 응답 DTO
 */
public record PaymentAnomalyResponse(
        @Schema(description = "이상 기록 ID")
        String anomalyId,

        @Schema(description = "주문 ID")
        String orderId,

        @Schema(description = "결제 시도 ID")
        String attemptId,

        @Schema(description = "유형", example = "DOUBLE_PAYMENT")
        AnomalyType type,

        @Schema(description = "상세")
        String detail,

        @Schema(description = "감지 시각")
        LocalDateTime detectedAt
) {
    public static PaymentAnomalyResponse from(PaymentAnomaly anomaly) {
        return new PaymentAnomalyResponse(
                anomaly.getAnomalyId(),
                anomaly.getOrderId(),
                anomaly.getAttemptId(),
                anomaly.getType(),
                anomaly.getDetail(),
                anomaly.getDetectedAt()
        );
    }
}
