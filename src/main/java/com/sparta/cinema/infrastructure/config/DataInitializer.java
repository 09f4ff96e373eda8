package com.sparta.cinema.infrastructure.config;

import com.sparta.cinema.domain.movie.entity.Movie;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.math.BigDecimal;
import java.util.List;

/**
 * 로컬 환경 초기 데이터
 */
@Slf4j
@Configuration
public class DataInitializer {

    @Bean
    @Profile("local")
    public CommandLineRunner initLocalMovies(MovieRepository movieRepository) {
        return args -> {
            if (movieRepository.count() > 0) {
                log.info("[DataInitializer] 영화 데이터가 이미 존재합니다 - count: {}", movieRepository.count());
                return;
            }

            List<Movie> movies = List.of(
                    movie("The Answer", "SF", 2019, "9.99"),
                    movie("Midnight Train", "Thriller", 2021, "12.50"),
                    movie("Paper Harbor", "Drama", 2018, "7.99"),
                    movie("Second Orbit", "SF", 2023, "14.99"),
                    movie("Quiet Kitchen", "Documentary", 2020, "4.99")
            );
            movieRepository.saveAll(movies);

            log.info("[DataInitializer] 로컬 영화 {} 편 생성 완료", movies.size());
        };
    }

    private Movie movie(String title, String genre, int releaseYear, String price) {
        return Movie.builder()
                .title(title)
                .description(title + " (" + releaseYear + ")")
                .genre(genre)
                .releaseYear(releaseYear)
                .price(new BigDecimal(price))
                .build();
    }
}
