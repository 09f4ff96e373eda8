package com.sparta.cinema.application.payment.dto;

import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 시도 응답 DTO
 */
public record PaymentAttemptResponse(
        @Schema(description = "결제 시도 ID")
        String attemptId,

        @Schema(description = "주문 ID")
        String orderId,

        @Schema(description = "시도 순번", example = "1")
        int sequence,

        @Schema(description = "대행사 참조번호")
        String gatewayReference,

        @Schema(description = "금액", example = "9.99")
        BigDecimal amount,

        @Schema(description = "결제 수단", example = "CARD")
        PaymentMethod method,

        @Schema(description = "상태", example = "SUCCEEDED")
        PaymentAttemptStatus status,

        @Schema(description = "실패 사유")
        String failureReason,

        @Schema(description = "시작 시각")
        LocalDateTime createdAt,

        @Schema(description = "종료 시각")
        LocalDateTime completedAt
) {
    public static PaymentAttemptResponse from(PaymentAttempt attempt) {
        return new PaymentAttemptResponse(
                attempt.getAttemptId(),
                attempt.getOrderId(),
                attempt.getSequence(),
                attempt.getGatewayReference(),
                attempt.getAmount(),
                attempt.getMethod(),
                attempt.getStatus(),
                attempt.getFailureReason(),
                attempt.getCreatedAt(),
                attempt.getCompletedAt()
        );
    }
}
