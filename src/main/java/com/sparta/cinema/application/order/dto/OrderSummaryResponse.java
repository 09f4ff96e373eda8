package com.sparta.cinema.application.order.dto;

import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 목록 항목 DTO
 */
public record OrderSummaryResponse(
        @Schema(description = "주문 ID")
        String orderId,

        @Schema(description = "사용자 ID", example = "user-1")
        String userId,

        @Schema(description = "주문 상태", example = "PAID")
        OrderStatus status,

        @Schema(description = "총 금액", example = "9.99")
        BigDecimal totalAmount,

        @Schema(description = "항목 수", example = "1")
        int itemCount,

        @Schema(description = "주문 시각")
        LocalDateTime createdAt
) {
    public static OrderSummaryResponse from(Order order, int itemCount) {
        return new OrderSummaryResponse(
                order.getOrderId(),
                order.getUserId(),
                order.getStatus(),
                order.getTotalAmount(),
                itemCount,
                order.getCreatedAt()
        );
    }
}
