package com.sparta.cinema.domain.payment.gateway;

/**
 * 멱등성 키로 조회한 대행사 결제 상태
 */
public record ChargeLookup(String reference, GatewayChargeStatus status) {

    public static ChargeLookup notFound() {
        return new ChargeLookup(null, GatewayChargeStatus.NOT_FOUND);
    }
}
