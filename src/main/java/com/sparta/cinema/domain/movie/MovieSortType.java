package com.sparta.cinema.domain.movie;

import java.util.Arrays;

/**
 * 영화 목록 정렬 타입
 */
public enum MovieSortType {

    TITLE("title", "제목순"),
    PRICE("price", "가격순"),
    NEWEST("newest", "최신 개봉순");

    private final String code;
    private final String description;

    MovieSortType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * code로부터 SortType 찾기, 알 수 없는 값이면 제목순
     */
    public static MovieSortType from(String code) {
        if (code == null || code.isBlank()) {
            return TITLE;
        }

        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst()
                .orElse(TITLE);
    }
}
