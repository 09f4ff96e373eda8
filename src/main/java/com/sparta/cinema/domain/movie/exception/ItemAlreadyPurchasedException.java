package com.sparta.cinema.domain.movie.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 결제 완료된 주문으로 이미 소유한 영화를 다시 담거나 주문할 때 발생하는 예외
 */
public class ItemAlreadyPurchasedException extends BusinessException {
    public ItemAlreadyPurchasedException(String movieId) {
        super(ErrorCode.M003, "이미 구매한 영화입니다: " + movieId);
    }
}
