package com.sparta.cinema.infrastructure.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 결제 대행사 결제 응답 (/v1/charges)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayChargeResponse(
        String reference,
        String status,
        String redirectUrl,
        String failureReason
) {
}
