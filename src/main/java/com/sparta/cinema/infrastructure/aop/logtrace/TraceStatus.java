package com.sparta.cinema.infrastructure.aop.logtrace;

public record TraceStatus(TraceId traceId, long startTimeMs, String message) {
}
