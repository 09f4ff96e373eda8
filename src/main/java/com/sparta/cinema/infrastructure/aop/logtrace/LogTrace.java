package com.sparta.cinema.infrastructure.aop.logtrace;

/**
 * 요청 단위 호출 흐름 로그
 */
public interface LogTrace {

    TraceStatus begin(String message);

    void end(TraceStatus status);

    void exception(TraceStatus status, Exception e);
}
