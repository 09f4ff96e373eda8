package com.sparta.cinema.application.order.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * 체크아웃 요청 DTO
 */
public record CheckoutRequest(
        @Schema(description = "사용자 ID", example = "user-1")
        @NotBlank(message = "사용자 ID는 필수입니다")
        String userId
) {
}
