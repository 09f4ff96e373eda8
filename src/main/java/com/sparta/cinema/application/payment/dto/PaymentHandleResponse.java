package com.sparta.cinema.application.payment.dto;

import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 결제 시작 응답 DTO
 */
public record PaymentHandleResponse(
        @Schema(description = "결제 시도 ID")
        String attemptId,

        @Schema(description = "주문 ID")
        String orderId,

        @Schema(description = "시도 순번", example = "1")
        int sequence,

        @Schema(description = "대행사 참조번호 (UNKNOWN이면 없음)")
        String gatewayReference,

        @Schema(description = "대행사 결제 페이지")
        String redirectUrl,

        @Schema(description = "접수 결과", example = "PENDING")
        PaymentHandleStatus status
) {
    public static PaymentHandleResponse of(PaymentAttempt attempt, PaymentHandleStatus status) {
        return new PaymentHandleResponse(
                attempt.getAttemptId(),
                attempt.getOrderId(),
                attempt.getSequence(),
                attempt.getGatewayReference(),
                attempt.getRedirectUrl(),
                status
        );
    }
}
