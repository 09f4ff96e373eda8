package com.sparta.cinema.domain.cart.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;
import com.sparta.cinema.domain.cart.entity.CartItem;

/**
 * 수량이 1 미만이거나 최대 수량을 넘을 때 발생하는 예외
 */
public class InvalidQuantityException extends BusinessException {
    public InvalidQuantityException(long quantity) {
        super(ErrorCode.CART003, "수량은 1개 이상 " + CartItem.MAX_QUANTITY + "개 이하여야 합니다: " + quantity);
    }
}
