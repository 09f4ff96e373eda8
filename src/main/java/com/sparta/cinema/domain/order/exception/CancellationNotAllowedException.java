package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 결제 결과가 확정되지 않았거나 이미 결제된 주문을 취소하려 할 때 발생하는 예외
 */
public class CancellationNotAllowedException extends BusinessException {
    public CancellationNotAllowedException(String orderId, String reason) {
        super(ErrorCode.O005, String.format("주문을 취소할 수 없습니다 (%s): %s", reason, orderId));
    }
}
