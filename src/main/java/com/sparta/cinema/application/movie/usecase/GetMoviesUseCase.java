package com.sparta.cinema.application.movie.usecase;

import com.sparta.cinema.application.movie.dto.MovieResponse;
import com.sparta.cinema.domain.movie.MovieSortType;
import com.sparta.cinema.domain.movie.entity.Movie;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

import static com.sparta.cinema.infrastructure.config.CacheConfig.MOVIE_LIST;

/**
 * 영화 목록 조회 UseCase
 *
 * [캐시 전략]
 * - Cache-Aside 패턴, TTL 10분
 * - 키: movieList::{genre}:{sort}
 * - 목록 화면 전용. 주문 가격은 캐시가 아니라 CatalogService에서 다시 읽는다
 */
@Service
@RequiredArgsConstructor
public class GetMoviesUseCase {

    private final MovieRepository movieRepository;

    @Cacheable(cacheNames = MOVIE_LIST, key = "(#genre ?: 'all') + ':' + (#sort ?: 'none')")
    @Transactional(readOnly = true)
    public List<MovieResponse> execute(String genre, String sort) {
        return fetchMovies(genre, MovieSortType.from(sort)).stream()
                .map(MovieResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 장르와 정렬 조건에 맞는 판매 중인 영화 조회
     */
    private List<Movie> fetchMovies(String genre, MovieSortType sortType) {
        boolean hasGenre = genre != null && !genre.isBlank();

        return switch (sortType) {
            case PRICE -> hasGenre
                    ? movieRepository.findByAvailableTrueAndGenreOrderByPriceAsc(genre)
                    : movieRepository.findByAvailableTrueOrderByPriceAsc();
            case NEWEST -> hasGenre
                    ? movieRepository.findByAvailableTrueAndGenreOrderByReleaseYearDesc(genre)
                    : movieRepository.findByAvailableTrueOrderByReleaseYearDesc();
            case TITLE -> hasGenre
                    ? movieRepository.findByAvailableTrueAndGenreOrderByTitleAsc(genre)
                    : movieRepository.findByAvailableTrueOrderByTitleAsc();
        };
    }
}
