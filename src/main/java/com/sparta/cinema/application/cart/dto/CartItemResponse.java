package com.sparta.cinema.application.cart.dto;

import com.sparta.cinema.domain.cart.entity.CartItem;
import com.sparta.cinema.domain.movie.entity.Movie;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 장바구니 항목 응답 DTO
 * 가격은 조회 시점의 카탈로그 가격이며 주문 금액은 체크아웃 때 다시 계산된다
 */
public record CartItemResponse(
        @Schema(description = "영화 ID", example = "movie-42")
        String movieId,

        @Schema(description = "제목", example = "The Answer")
        String title,

        @Schema(description = "현재 가격", example = "9.99")
        BigDecimal price,

        @Schema(description = "수량", example = "1")
        int quantity,

        @Schema(description = "소계", example = "9.99")
        BigDecimal subtotal,

        @Schema(description = "구매 가능 여부", example = "true")
        boolean available,

        @Schema(description = "담은 시각")
        LocalDateTime addedAt
) {
    public static CartItemResponse from(CartItem cartItem, Movie movie) {
        return new CartItemResponse(
                cartItem.getMovieId(),
                movie.getTitle(),
                movie.getPrice(),
                cartItem.getQuantity(),
                movie.getPrice().multiply(BigDecimal.valueOf(cartItem.getQuantity())),
                movie.isAvailable(),
                cartItem.getAddedAt()
        );
    }

    /**
     * 카탈로그에서 사라진 영화
     */
    public static CartItemResponse missing(CartItem cartItem) {
        return new CartItemResponse(
                cartItem.getMovieId(),
                null,
                null,
                cartItem.getQuantity(),
                BigDecimal.ZERO,
                false,
                cartItem.getAddedAt()
        );
    }
}
