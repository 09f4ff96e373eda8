package com.sparta.cinema.application.payment.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 콜백 확인 응답
 */
public record PaymentCallbackResponse(
        @Schema(description = "대행사 이벤트 ID")
        String eventId,

        @Schema(description = "처리 결과", example = "APPLIED")
        CallbackResult result
) {
}
