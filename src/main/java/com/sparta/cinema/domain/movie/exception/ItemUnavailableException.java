package com.sparta.cinema.domain.movie.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 판매가 중지되었거나 사라진 영화를 담거나 주문할 때 발생하는 예외
 */
public class ItemUnavailableException extends BusinessException {
    public ItemUnavailableException(String movieId) {
        super(ErrorCode.M002, "구매할 수 없는 영화입니다: " + movieId);
    }
}
