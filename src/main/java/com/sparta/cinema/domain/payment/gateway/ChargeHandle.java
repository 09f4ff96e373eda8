package com.sparta.cinema.domain.payment.gateway;

/**
 * 결제 요청 접수 결과
 *
 * @param reference   대행사 결제 참조번호
 * @param redirectUrl 사용자가 결제를 마칠 대행사 페이지
 * @param status      접수 시점의 상태 (보통 PENDING)
 */
public record ChargeHandle(String reference, String redirectUrl, GatewayChargeStatus status) {
}
