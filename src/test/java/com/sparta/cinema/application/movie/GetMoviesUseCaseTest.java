package com.sparta.cinema.application.movie;

import com.sparta.cinema.application.movie.dto.MovieResponse;
import com.sparta.cinema.application.movie.usecase.GetMoviesUseCase;
import com.sparta.cinema.domain.movie.entity.Movie;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("영화 목록 조회 UseCase 테스트")
class GetMoviesUseCaseTest {

    @Mock
    private MovieRepository movieRepository;

    @InjectMocks
    private GetMoviesUseCase getMoviesUseCase;

    private Movie movie(String id, String title, String genre, int year, String price) {
        return Movie.builder()
                .movieId(id).title(title).genre(genre)
                .releaseYear(year).price(new BigDecimal(price))
                .build();
    }

    @Test
    @DisplayName("조건 없이 조회하면 판매 중인 영화를 제목순으로 반환한다")
    void 기본_조회() {
        // given
        given(movieRepository.findByAvailableTrueOrderByTitleAsc()).willReturn(List.of(
                movie("M1", "Alien", "SF", 1979, "4.99"),
                movie("M2", "Heat", "Crime", 1995, "5.99")));

        // when
        List<MovieResponse> responses = getMoviesUseCase.execute(null, null);

        // then
        assertThat(responses).extracting(MovieResponse::title).containsExactly("Alien", "Heat");
        verify(movieRepository, never()).findByAvailableTrueAndGenreOrderByTitleAsc(anyString());
    }

    @Test
    @DisplayName("장르와 가격순 정렬을 함께 적용한다")
    void 장르_가격순() {
        // given
        given(movieRepository.findByAvailableTrueAndGenreOrderByPriceAsc("SF")).willReturn(List.of(
                movie("M1", "Alien", "SF", 1979, "4.99"),
                movie("M3", "Dune", "SF", 2021, "14.99")));

        // when
        List<MovieResponse> responses = getMoviesUseCase.execute("SF", "price");

        // then
        assertThat(responses).hasSize(2);
        assertThat(responses).allMatch(r -> r.genre().equals("SF"));
        assertThat(responses.get(0).price()).isEqualByComparingTo("4.99");
    }

    @Test
    @DisplayName("알 수 없는 정렬 값은 제목순으로 처리한다")
    void 알수없는_정렬() {
        // given
        given(movieRepository.findByAvailableTrueOrderByTitleAsc()).willReturn(List.of());

        // when
        List<MovieResponse> responses = getMoviesUseCase.execute(" ", "rating");

        // then
        assertThat(responses).isEmpty();
        verify(movieRepository).findByAvailableTrueOrderByTitleAsc();
    }

    @Test
    @DisplayName("최신 개봉순 정렬")
    void 최신순() {
        // given
        given(movieRepository.findByAvailableTrueOrderByReleaseYearDesc()).willReturn(List.of(
                movie("M3", "Dune", "SF", 2021, "14.99"),
                movie("M2", "Heat", "Crime", 1995, "5.99")));

        // when
        List<MovieResponse> responses = getMoviesUseCase.execute(null, "NEWEST");

        // then
        assertThat(responses).extracting(MovieResponse::releaseYear).containsExactly(2021, 1995);
    }
}
