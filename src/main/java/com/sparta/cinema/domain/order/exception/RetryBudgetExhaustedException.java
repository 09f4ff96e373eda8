package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 결제 재시도 횟수를 모두 사용한 주문에 다시 결제를 시작할 때 발생하는 예외
 */
public class RetryBudgetExhaustedException extends BusinessException {
    public RetryBudgetExhaustedException(String orderId, int maxAttempts) {
        super(ErrorCode.O006, String.format("결제는 최대 %d회까지 시도할 수 있습니다: %s", maxAttempts, orderId));
    }
}
