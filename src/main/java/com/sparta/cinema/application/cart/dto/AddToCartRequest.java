package com.sparta.cinema.application.cart.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 장바구니 담기 요청 DTO
 */
public record AddToCartRequest(
        @Schema(description = "사용자 ID", example = "user-1")
        @NotBlank(message = "사용자 ID는 필수입니다")
        String userId,

        @Schema(description = "영화 ID", example = "movie-42")
        @NotBlank(message = "영화 ID는 필수입니다")
        String movieId,

        @Schema(description = "수량", example = "1")
        @Min(value = 1, message = "수량은 1개 이상이어야 합니다")
        @Max(value = 99, message = "수량은 99개 이하여야 합니다")
        int quantity
) {
}
