package com.sparta.cinema.domain.movie.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 존재하지 않는 영화를 조회할 때 발생하는 예외
 */
public class MovieNotFoundException extends BusinessException {
    public MovieNotFoundException(String movieId) {
        super(ErrorCode.M001, "영화를 찾을 수 없습니다: " + movieId);
    }
}
