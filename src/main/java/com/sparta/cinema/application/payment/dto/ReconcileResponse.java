package com.sparta.cinema.application.payment.dto;

import com.sparta.cinema.domain.order.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 대사 결과 응답 DTO
 */
public record ReconcileResponse(
        @Schema(description = "주문 ID")
        String orderId,

        @Schema(description = "대사 후 주문 상태", example = "PAID")
        OrderStatus orderStatus,

        @Schema(description = "대사 결과", example = "SUCCEEDED")
        ReconcileOutcome outcome
) {
}
