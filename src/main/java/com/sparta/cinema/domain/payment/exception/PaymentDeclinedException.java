package com.sparta.cinema.domain.payment.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 결제 대행사가 결제를 명시적으로 거절했을 때 발생하는 예외
 */
@Getter
public class PaymentDeclinedException extends BusinessException {

    private final String reason;

    public PaymentDeclinedException(String reason) {
        super(ErrorCode.PAY001, "결제가 거절되었습니다: " + reason);
        this.reason = reason;
    }
}
