package com.sparta.cinema.application.order.dto;

import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.entity.OrderItem;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO
 */
public record OrderResponse(
        @Schema(description = "주문 ID")
        String orderId,

        @Schema(description = "사용자 ID", example = "user-1")
        String userId,

        @Schema(description = "주문 상태", example = "DRAFT")
        OrderStatus status,

        @Schema(description = "총 금액", example = "9.99")
        BigDecimal totalAmount,

        @Schema(description = "결제 시도 횟수", example = "0")
        int attemptCount,

        @Schema(description = "수동 검토 여부", example = "false")
        boolean frozen,

        @Schema(description = "주문 항목")
        List<OrderItemResponse> items,

        @Schema(description = "주문 시각")
        LocalDateTime createdAt,

        @Schema(description = "결제 완료 시각")
        LocalDateTime paidAt,

        @Schema(description = "취소 시각")
        LocalDateTime cancelledAt
) {
    public static OrderResponse from(Order order, List<OrderItem> items) {
        return new OrderResponse(
                order.getOrderId(),
                order.getUserId(),
                order.getStatus(),
                order.getTotalAmount(),
                order.getAttemptCount(),
                order.isFrozen(),
                items.stream().map(OrderItemResponse::from).toList(),
                order.getCreatedAt(),
                order.getPaidAt(),
                order.getCancelledAt()
        );
    }
}
