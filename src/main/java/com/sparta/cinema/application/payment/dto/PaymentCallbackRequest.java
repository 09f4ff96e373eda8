package com.sparta.cinema.application.payment.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 결제 대행사 콜백 메시지
 */
public record PaymentCallbackRequest(
        @Schema(description = "대행사 이벤트 ID (중복 제거 기준)", example = "evt_1001")
        @NotBlank(message = "eventId는 필수입니다")
        String eventId,

        @Schema(description = "대행사 결제 참조번호", example = "ch_9f8e7d")
        @Size(max = 255, message = "gatewayReference는 255자 이하여야 합니다")
        String gatewayReference,

        @Schema(description = "결제 요청 시 보낸 멱등성 키", example = "0b6f...:1")
        @Size(max = 100, message = "idempotencyKey는 100자 이하여야 합니다")
        String idempotencyKey,

        @Schema(description = "결과", example = "SUCCEEDED")
        @NotNull(message = "outcome은 필수입니다")
        CallbackOutcome outcome,

        @Schema(description = "실패 사유")
        @Size(max = 500, message = "실패 사유는 500자 이하여야 합니다")
        String failureReason
) {
    @Schema(hidden = true)
    @AssertTrue(message = "gatewayReference 또는 idempotencyKey 중 하나는 필수입니다")
    public boolean isLocatable() {
        return hasText(gatewayReference) || hasText(idempotencyKey);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
