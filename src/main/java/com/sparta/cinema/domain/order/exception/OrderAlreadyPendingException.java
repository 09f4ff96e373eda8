package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 같은 영화가 담긴 미결제 주문이 이미 있을 때 발생하는 예외
 */
public class OrderAlreadyPendingException extends BusinessException {
    public OrderAlreadyPendingException(String movieId) {
        super(ErrorCode.O003, "결제 대기 중인 주문에 이미 포함된 영화입니다: " + movieId);
    }
}
