package com.sparta.cinema.domain.payment.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 결제 대행사 호출이 실패했을 때 발생하는 예외 (환불 등 결과를 확정해야 하는 호출)
 */
public class PaymentGatewayException extends BusinessException {
    public PaymentGatewayException(String message) {
        super(ErrorCode.PAY002, message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(ErrorCode.PAY002, message, cause);
    }
}
