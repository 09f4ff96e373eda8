package com.sparta.cinema.application.order.dto;

import com.sparta.cinema.application.payment.dto.PaymentAttemptResponse;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 주문 상세 응답 DTO (주문 + 결제 시도 이력)
 */
public record OrderDetailResponse(
        @Schema(description = "주문")
        OrderResponse order,

        @Schema(description = "결제 시도 이력 (순번 오름차순)")
        List<PaymentAttemptResponse> payments
) {
}
