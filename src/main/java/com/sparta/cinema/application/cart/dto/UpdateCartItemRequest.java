package com.sparta.cinema.application.cart.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 장바구니 항목 수량 변경 요청 DTO
 */
public record UpdateCartItemRequest(
        @Schema(description = "변경할 수량", example = "2")
        @Min(value = 1, message = "수량은 1개 이상이어야 합니다")
        @Max(value = 99, message = "수량은 99개 이하여야 합니다")
        int quantity
) {
}
