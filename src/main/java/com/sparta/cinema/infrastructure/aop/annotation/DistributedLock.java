package com.sparta.cinema.infrastructure.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산 락 어노테이션
 *
 * key는 Spring EL로 평가되며 "lock:" 접두사가 붙는다.
 * 예: @DistributedLock(key = "'cart:user:' + #userId")
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 키 (Spring EL)
     */
    String key();

    /**
     * 락 획득 대기 시간
     */
    long waitTime() default 5L;

    /**
     * 락 임대 시간. 이 시간이 지나면 자동 해제된다.
     */
    long leaseTime() default 10L;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
