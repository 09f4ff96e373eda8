package com.sparta.cinema.application.movie.service;

import com.sparta.cinema.domain.movie.CatalogItem;
import com.sparta.cinema.domain.movie.CatalogService;
import com.sparta.cinema.domain.movie.entity.Movie;
import com.sparta.cinema.domain.movie.exception.MovieNotFoundException;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 영화 테이블 기반 카탈로그 구현
 * 캐시를 거치지 않고 항상 DB에서 현재 가격을 읽는다
 */
@Service
@RequiredArgsConstructor
public class MovieCatalogService implements CatalogService {

    private final MovieRepository movieRepository;

    @Override
    @Transactional(readOnly = true)
    public CatalogItem getItem(String itemId) {
        Movie movie = movieRepository.findById(itemId)
                .orElseThrow(() -> new MovieNotFoundException(itemId));

        return new CatalogItem(movie.getMovieId(), movie.getTitle(), movie.getPrice(), movie.isAvailable());
    }
}
