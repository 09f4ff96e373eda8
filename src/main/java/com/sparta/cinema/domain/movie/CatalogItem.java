package com.sparta.cinema.domain.movie;

import java.math.BigDecimal;

/**
 * 카탈로그 조회 결과
 * 체크아웃 시점의 가격과 판매 가능 여부
 */
public record CatalogItem(
        String itemId,
        String title,
        BigDecimal price,
        boolean available
) {
}
