package com.sparta.cinema.domain.payment.gateway;

/**
 * 결제 대행사 응답을 받지 못함 (타임아웃, 연결 실패, 5xx)
 *
 * 결제가 실제로 승인되었는지 알 수 없는 상태다. 거절로 취급하지 않고 대사로 확정한다.
 * API 응답으로 나가지 않는 내부 예외.
 */
public class GatewayTimeoutException extends RuntimeException {
    public GatewayTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    public GatewayTimeoutException(String message) {
        super(message);
    }
}
