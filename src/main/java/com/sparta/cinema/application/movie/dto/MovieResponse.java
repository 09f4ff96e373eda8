package com.sparta.cinema.application.movie.dto;

import com.sparta.cinema.domain.movie.entity.Movie;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

/**
 * 영화 응답 DTO
 */
public record MovieResponse(
        @Schema(description = "영화 ID", example = "movie-42")
        String movieId,

        @Schema(description = "제목", example = "The Answer")
        String title,

        @Schema(description = "설명")
        String description,

        @Schema(description = "장르", example = "SF")
        String genre,

        @Schema(description = "개봉 연도", example = "2019")
        int releaseYear,

        @Schema(description = "가격 (USD)", example = "9.99")
        BigDecimal price,

        @Schema(description = "판매 여부", example = "true")
        boolean available
) {
    public static MovieResponse from(Movie movie) {
        return new MovieResponse(
                movie.getMovieId(),
                movie.getTitle(),
                movie.getDescription(),
                movie.getGenre(),
                movie.getReleaseYear(),
                movie.getPrice(),
                movie.isAvailable()
        );
    }
}
