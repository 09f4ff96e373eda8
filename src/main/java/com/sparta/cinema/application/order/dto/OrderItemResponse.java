package com.sparta.cinema.application.order.dto;

import com.sparta.cinema.domain.order.entity.OrderItem;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

/**
 * 주문 항목 응답 DTO
 */
public record OrderItemResponse(
        @Schema(description = "영화 ID", example = "movie-42")
        String movieId,

        @Schema(description = "주문 당시 제목", example = "The Answer")
        String movieTitle,

        @Schema(description = "주문 당시 가격", example = "9.99")
        BigDecimal unitPrice,

        @Schema(description = "수량", example = "1")
        int quantity,

        @Schema(description = "소계", example = "9.99")
        BigDecimal subtotal
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getMovieId(),
                item.getMovieTitle(),
                item.getUnitPrice(),
                item.getQuantity(),
                item.getSubtotal()
        );
    }
}
