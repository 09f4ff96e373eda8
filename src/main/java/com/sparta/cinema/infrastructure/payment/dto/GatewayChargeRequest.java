package com.sparta.cinema.infrastructure.payment.dto;

/**
 * POST /v1/charges 요청 본문
 *
 * @param amount    최소 화폐 단위 (USD 센트)
 * @param reference 멱등성 키와 같은 값. 콜백에 그대로 실려 온다
 */
public record GatewayChargeRequest(
        long amount,
        String currency,
        String method,
        String reference,
        String returnUrl
) {
}
