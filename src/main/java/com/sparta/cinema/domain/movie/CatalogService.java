package com.sparta.cinema.domain.movie;

import com.sparta.cinema.domain.movie.exception.MovieNotFoundException;

/**
 * 카탈로그 조회 포트
 * 주문 엔진은 가격/판매 여부를 항상 이 인터페이스로 다시 조회한다
 */
public interface CatalogService {

    /**
     * @throws MovieNotFoundException 존재하지 않는 영화
     */
    CatalogItem getItem(String itemId);
}
