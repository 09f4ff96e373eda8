package com.sparta.cinema.application.cart.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 응답 DTO
 */
public record CartResponse(
        @Schema(description = "사용자 ID", example = "user-1")
        String userId,

        @Schema(description = "장바구니 항목 목록 (담은 순서)")
        List<CartItemResponse> items,

        @Schema(description = "예상 총 금액", example = "9.99")
        BigDecimal totalAmount
) {
    public static CartResponse of(String userId, List<CartItemResponse> items) {
        BigDecimal totalAmount = items.stream()
                .map(CartItemResponse::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new CartResponse(userId, items, totalAmount);
    }
}
