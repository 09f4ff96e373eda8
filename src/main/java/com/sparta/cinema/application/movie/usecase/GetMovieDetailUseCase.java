package com.sparta.cinema.application.movie.usecase;

import com.sparta.cinema.application.movie.dto.MovieResponse;
import com.sparta.cinema.domain.movie.exception.MovieNotFoundException;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 영화 상세 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetMovieDetailUseCase {

    private final MovieRepository movieRepository;

    @Transactional(readOnly = true)
    public MovieResponse execute(String movieId) {
        return movieRepository.findById(movieId)
                .map(MovieResponse::from)
                .orElseThrow(() -> new MovieNotFoundException(movieId));
    }
}
