package com.sparta.cinema.presentation.exception;

/**
 * 에러 응답 DTO
 */
public record ErrorResponse(
    String code,
    String message
) {
}
