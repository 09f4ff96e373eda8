package com.sparta.cinema.infrastructure.aop.config;

import com.sparta.cinema.infrastructure.aop.logtrace.LogTrace;
import com.sparta.cinema.infrastructure.aop.logtrace.LogTraceAspect;
import com.sparta.cinema.infrastructure.aop.logtrace.ThreadLocalLogTrace;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 유스케이스 호출 추적 설정
 * {@code @Trace}가 붙은 클래스의 메서드 호출을 요청 스레드 단위로 들여쓰기해 로그로 남긴다
 */
@Configuration
public class AopConfig {

    @Bean
    public LogTraceAspect logTraceAspect(LogTrace logTrace) {
        return new LogTraceAspect(logTrace);
    }

    @Bean
    public LogTrace logTrace() {
        return new ThreadLocalLogTrace();
    }
}
