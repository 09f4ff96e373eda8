package com.sparta.cinema.application.payment.dto;

import com.sparta.cinema.domain.payment.PaymentMethod;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 결제 시작 요청 DTO
 */
public record InitiatePaymentRequest(
        @Schema(description = "사용자 ID", example = "user-1")
        @NotBlank(message = "사용자 ID는 필수입니다")
        String userId,

        @Schema(description = "결제 수단", example = "CARD")
        @NotNull(message = "결제 수단은 필수입니다")
        PaymentMethod method
) {
}
