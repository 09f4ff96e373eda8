package com.sparta.cinema.domain.payment.gateway;

import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.exception.PaymentDeclinedException;
import com.sparta.cinema.domain.payment.exception.PaymentGatewayException;

import java.math.BigDecimal;

/**
 * 결제 대행사 연동 포트
 *
 * 모든 호출은 제한된 시간 안에 끝나며, 응답을 받지 못하면 GatewayTimeoutException을 던진다.
 * 구현체를 바꿔도 주문 엔진은 영향을 받지 않는다.
 */
public interface PaymentGateway {

    /**
     * 결제 요청. 같은 멱등성 키로 다시 호출해도 결제는 한 번만 생성된다.
     *
     * @throws PaymentDeclinedException 대행사가 결제를 거절함
     * @throws GatewayTimeoutException  결과를 알 수 없음
     */
    ChargeHandle charge(String idempotencyKey, BigDecimal amount, PaymentMethod method);

    /**
     * 멱등성 키로 결제 상태 조회. 결제가 없으면 NOT_FOUND
     *
     * @throws GatewayTimeoutException 결과를 알 수 없음
     */
    ChargeLookup lookup(String idempotencyKey);

    /**
     * 승인된 결제 환불
     *
     * @throws PaymentGatewayException 환불 요청 실패
     * @throws GatewayTimeoutException 결과를 알 수 없음
     */
    GatewayChargeStatus refund(String reference, BigDecimal amount);
}
