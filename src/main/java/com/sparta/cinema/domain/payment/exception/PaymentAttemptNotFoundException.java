package com.sparta.cinema.domain.payment.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 콜백이 가리키는 결제 시도를 찾을 수 없을 때 발생하는 예외
 * 404를 받은 대행사는 콜백을 다시 보낸다
 */
public class PaymentAttemptNotFoundException extends BusinessException {
    public PaymentAttemptNotFoundException(String gatewayReference, String idempotencyKey) {
        super(ErrorCode.PAY003, String.format("결제 시도를 찾을 수 없습니다 - reference: %s, idempotencyKey: %s",
                gatewayReference, idempotencyKey));
    }
}
