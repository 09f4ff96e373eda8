package com.sparta.cinema.presentation.controller.movie;

import com.sparta.cinema.application.movie.dto.MovieResponse;
import com.sparta.cinema.application.movie.usecase.GetMovieDetailUseCase;
import com.sparta.cinema.application.movie.usecase.GetMoviesUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 영화 카탈로그 API
 */
@Tag(name = "영화 카탈로그", description = "판매 중인 영화 조회 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/movies")
public class MovieController {

    private final GetMoviesUseCase getMoviesUseCase;
    private final GetMovieDetailUseCase getMovieDetailUseCase;

    /**
     * 영화 목록 조회
     * GET /api/movies
     */
    @Operation(summary = "영화 목록 조회", description = "장르 필터와 정렬(title/price/newest)을 지원합니다")
    @GetMapping
    public ResponseEntity<List<MovieResponse>> getMovies(
            @Parameter(description = "장르") @RequestParam(required = false) String genre,
            @Parameter(description = "정렬 기준 (title/price/newest)") @RequestParam(required = false) String sort) {

        return ResponseEntity.ok(getMoviesUseCase.execute(genre, sort));
    }

    /**
     * 영화 상세 조회
     * GET /api/movies/{movieId}
     */
    @Operation(summary = "영화 상세 조회", description = "특정 영화의 상세 정보를 조회합니다")
    @GetMapping("/{movieId}")
    public ResponseEntity<MovieResponse> getMovie(
            @Parameter(description = "영화 ID") @PathVariable String movieId) {

        return ResponseEntity.ok(getMovieDetailUseCase.execute(movieId));
    }
}
