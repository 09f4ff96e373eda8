package com.sparta.cinema.infrastructure.payment.dto;

/**
 * POST /v1/charges/{reference}/refunds 요청 본문
 */
public record GatewayRefundRequest(long amount, String currency) {
}
