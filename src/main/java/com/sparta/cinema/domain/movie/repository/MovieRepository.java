package com.sparta.cinema.domain.movie.repository;

import com.sparta.cinema.domain.movie.entity.Movie;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * 영화 저장소 인터페이스
 */
public interface MovieRepository extends JpaRepository<Movie, String> {

    List<Movie> findByAvailableTrueOrderByTitleAsc();

    List<Movie> findByAvailableTrueAndGenreOrderByTitleAsc(String genre);

    List<Movie> findByAvailableTrueOrderByPriceAsc();

    List<Movie> findByAvailableTrueAndGenreOrderByPriceAsc(String genre);

    List<Movie> findByAvailableTrueOrderByReleaseYearDesc();

    List<Movie> findByAvailableTrueAndGenreOrderByReleaseYearDesc(String genre);
}
